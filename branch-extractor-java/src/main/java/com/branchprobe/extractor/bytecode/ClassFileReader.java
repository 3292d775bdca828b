package com.branchprobe.extractor.bytecode;

import com.branchprobe.extractor.ir.Module;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the IR of JVM class files: one {@link Module} per class, one function per method
 * with code, named {@code owner::name(descriptor)} with a dotted owner.
 *
 * Conditional jumps become an {@code icmp} feeding a {@code br i1} whose first successor is
 * the jump target, one per jump in bytecode order. A method's branch IDs under per-function
 * scope are therefore the ordinals the bytecode agent records for the same method.
 */
public class ClassFileReader {

    public static class ClassReadException extends RuntimeException {
        public ClassReadException(String message) { super(message); }
        public ClassReadException(String message, Throwable cause) { super(message, cause); }
    }

    private final List<String> includeMethods;

    public ClassFileReader() {
        this(Collections.emptyList());
    }

    /**
     * @param includeMethods prefixes matched against {@code owner::name}; empty means all methods
     */
    public ClassFileReader(List<String> includeMethods) {
        this.includeMethods = List.copyOf(includeMethods);
    }

    /**
     * Reads a {@code .class} file, a jar, or every class file under a directory.
     * Classes are returned sorted by file or entry name.
     */
    public List<Module> readAll(Path input) {
        if (Files.isDirectory(input)) {
            try (Stream<Path> walk = Files.walk(input)) {
                List<Path> classFiles = walk
                        .filter(p -> p.toString().endsWith(".class"))
                        .sorted()
                        .collect(Collectors.toList());
                List<Module> modules = new ArrayList<>();
                for (Path p : classFiles) {
                    modules.add(read(p));
                }
                return modules;
            } catch (IOException e) {
                throw new ClassReadException("Failed to scan " + input + ": " + e.getMessage(), e);
            }
        }
        if (input.toString().endsWith(".jar")) {
            return readJar(input);
        }
        return List.of(read(input));
    }

    public Module read(Path classFile) {
        if (!Files.isRegularFile(classFile)) {
            throw new ClassReadException("Class file not found: " + classFile);
        }
        try {
            return read(Files.readAllBytes(classFile));
        } catch (IOException e) {
            throw new ClassReadException("Failed to read " + classFile + ": " + e.getMessage(), e);
        }
    }

    public Module read(byte[] classBytes) {
        ClassNode cn = new ClassNode(Opcodes.ASM9);
        try {
            new ClassReader(classBytes).accept(cn, ClassReader.SKIP_FRAMES);
        } catch (RuntimeException e) {
            throw new ClassReadException("Not a valid class file: " + e.getMessage(), e);
        }

        String owner = Type.getObjectType(cn.name).getClassName();
        Module module = new Module(owner);
        for (MethodNode mn : cn.methods) {
            if ((mn.access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0) {
                continue;
            }
            if (!included(owner + "::" + mn.name)) {
                continue;
            }
            try {
                new MethodTranslator(cn.name, mn, module).translate();
            } catch (ClassReadException e) {
                System.err.println("[branch-extractor] ERROR: skipping method " + owner + "::" + mn.name + mn.desc
                        + ": " + e.getMessage());
            }
        }
        return module;
    }

    private List<Module> readJar(Path jar) {
        List<Module> modules = new ArrayList<>();
        try (JarFile jf = new JarFile(jar.toFile())) {
            List<JarEntry> entries = new ArrayList<>();
            for (Enumeration<JarEntry> e = jf.entries(); e.hasMoreElements(); ) {
                JarEntry entry = e.nextElement();
                if (!entry.isDirectory() && entry.getName().endsWith(".class")
                        && !entry.getName().endsWith("module-info.class")) {
                    entries.add(entry);
                }
            }
            entries.sort((a, b) -> a.getName().compareTo(b.getName()));
            for (JarEntry entry : entries) {
                try (InputStream in = jf.getInputStream(entry)) {
                    modules.add(read(in.readAllBytes()));
                }
            }
        } catch (IOException e) {
            throw new ClassReadException("Failed to read jar " + jar + ": " + e.getMessage(), e);
        }
        return modules;
    }

    private boolean included(String qualifiedMethod) {
        if (includeMethods.isEmpty()) {
            return true;
        }
        for (String prefix : includeMethods) {
            if (qualifiedMethod.startsWith(prefix)) return true;
        }
        return false;
    }
}
