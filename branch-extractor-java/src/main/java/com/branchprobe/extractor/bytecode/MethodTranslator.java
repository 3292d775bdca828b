package com.branchprobe.extractor.bytecode;

import com.branchprobe.extractor.bytecode.ClassFileReader.ClassReadException;
import com.branchprobe.extractor.ir.BasicBlock;
import com.branchprobe.extractor.ir.Constant;
import com.branchprobe.extractor.ir.Function;
import com.branchprobe.extractor.ir.FunctionBuilder;
import com.branchprobe.extractor.ir.Instruction;
import com.branchprobe.extractor.ir.IrType;
import com.branchprobe.extractor.ir.Module;
import com.branchprobe.extractor.ir.Opcode;
import com.branchprobe.extractor.ir.Predicate;
import com.branchprobe.extractor.ir.Value;
import org.objectweb.asm.ConstantDynamic;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.IincInsnNode;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.LocalVariableNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.MultiANewArrayInsnNode;
import org.objectweb.asm.tree.TableSwitchInsnNode;
import org.objectweb.asm.tree.TryCatchBlockNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;
import org.objectweb.asm.tree.analysis.Analyzer;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.objectweb.asm.tree.analysis.Frame;
import org.objectweb.asm.tree.analysis.SourceValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.objectweb.asm.Opcodes.*;

/**
 * Translates one method into an {@code -O0}-style function.
 *
 * Every local variable slot becomes an {@code alloca} in the entry block; parameters are
 * stored into their slots on entry, and {@code xload}/{@code xstore} become {@code load}/
 * {@code store}. Stack operands are resolved through {@link OperandTracer}: constant pushes
 * are inlined as constants, any other producer is referenced directly. A stack value merged
 * from several paths is passed through a {@code tmp} slot, stored after each producer and
 * loaded at the consumer. Code the analyzer proves unreachable keeps only its control flow,
 * with {@code undef} operands.
 */
final class MethodTranslator {

    private static final IrType[] LOCAL_TYPES = {IrType.I32, IrType.I64, IrType.FLOAT, IrType.DOUBLE, IrType.PTR};
    private static final IrType[] ARRAY_TYPES = {
            IrType.I32, IrType.I64, IrType.FLOAT, IrType.DOUBLE, IrType.PTR, IrType.I32, IrType.I32, IrType.I32};

    private final String ownerInternalName;
    private final MethodNode method;
    private final Module module;

    private FunctionBuilder b;
    private Frame<SourceValue>[] frames;
    private BasicBlock entry;
    private BasicBlock current;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final Map<AbstractInsnNode, BasicBlock> blockByLeader = new IdentityHashMap<>();
    private final Map<AbstractInsnNode, Value> produced = new IdentityHashMap<>();
    private final Map<String, Instruction> slots = new HashMap<>();
    private final Map<AbstractInsnNode, List<Set<AbstractInsnNode>>> mergesByProducer = new IdentityHashMap<>();
    private final Map<Set<AbstractInsnNode>, Instruction> temps = new HashMap<>();
    private final Set<String> usedNames = new HashSet<>();

    MethodTranslator(String ownerInternalName, MethodNode method, Module module) {
        this.ownerInternalName = ownerInternalName;
        this.method = method;
        this.module = module;
    }

    Function translate() {
        try {
            frames = new Analyzer<>(new OperandTracer()).analyze(ownerInternalName, method);
        } catch (AnalyzerException e) {
            throw new ClassReadException("Bytecode analysis failed: " + e.getMessage(), e);
        }

        List<AbstractInsnNode> code = new ArrayList<>();
        for (AbstractInsnNode n = method.instructions.getFirst(); n != null; n = n.getNext()) {
            if (n.getOpcode() == JSR || n.getOpcode() == RET) {
                throw new ClassReadException("jsr/ret subroutines are not supported");
            }
            if (n.getOpcode() >= 0) code.add(n);
        }
        if (code.isEmpty()) {
            throw new ClassReadException("method has no code");
        }

        b = FunctionBuilder.define(module, functionName(), irType(Type.getReturnType(method.desc)), parameters());

        Set<AbstractInsnNode> targets = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<AbstractInsnNode> leaders = findLeaders(code, targets);
        boolean prologue = targets.contains(code.get(0));
        if (prologue) {
            entry = b.block(null);
        }
        List<List<AbstractInsnNode>> groups = new ArrayList<>();
        for (AbstractInsnNode n : code) {
            if (leaders.contains(n)) {
                BasicBlock block = b.block(null);
                blocks.add(block);
                blockByLeader.put(n, block);
                groups.add(new ArrayList<>());
            }
            groups.get(groups.size() - 1).add(n);
        }
        if (!prologue) {
            entry = blocks.get(0);
        }

        collectMerges(code);

        current = entry;
        b.at(entry);
        emitPrologue(code);
        if (prologue) {
            b.br(blocks.get(0));
        }

        Map<AbstractInsnNode, List<TryCatchBlockNode>> handlers = handlersByStart();
        for (int k = 0; k < blocks.size(); k++) {
            current = blocks.get(k);
            b.at(current);
            List<AbstractInsnNode> group = groups.get(k);
            List<TryCatchBlockNode> caught = handlers.get(group.get(0));
            if (caught != null) {
                emitLandingPad(caught);
            }
            for (AbstractInsnNode n : group) {
                translate(n);
            }
            if (current.terminator() == null) {
                if (k + 1 >= blocks.size()) {
                    throw new ClassReadException("execution falls off the end of the code");
                }
                b.br(blocks.get(k + 1));
            }
        }
        return b.function();
    }

    // -----------------------------------------------------------------------
    // Structure
    // -----------------------------------------------------------------------

    private Set<AbstractInsnNode> findLeaders(List<AbstractInsnNode> code, Set<AbstractInsnNode> targets) {
        Set<AbstractInsnNode> leaders = Collections.newSetFromMap(new IdentityHashMap<>());
        leaders.add(code.get(0));
        for (int k = 0; k < code.size(); k++) {
            AbstractInsnNode n = code.get(k);
            boolean endsBlock = true;
            if (n instanceof JumpInsnNode j) {
                targets.add(firstCode(j.label));
            } else if (n instanceof TableSwitchInsnNode t) {
                targets.add(firstCode(t.dflt));
                for (LabelNode l : t.labels) targets.add(firstCode(l));
            } else if (n instanceof LookupSwitchInsnNode l) {
                targets.add(firstCode(l.dflt));
                for (LabelNode label : l.labels) targets.add(firstCode(label));
            } else {
                int op = n.getOpcode();
                endsBlock = (op >= IRETURN && op <= RETURN) || op == ATHROW;
            }
            if (endsBlock && k + 1 < code.size()) {
                leaders.add(code.get(k + 1));
            }
        }
        for (TryCatchBlockNode tcb : method.tryCatchBlocks) {
            targets.add(firstCode(tcb.handler));
        }
        leaders.addAll(targets);
        return leaders;
    }

    private Map<AbstractInsnNode, List<TryCatchBlockNode>> handlersByStart() {
        Map<AbstractInsnNode, List<TryCatchBlockNode>> byStart = new IdentityHashMap<>();
        for (TryCatchBlockNode tcb : method.tryCatchBlocks) {
            byStart.computeIfAbsent(firstCode(tcb.handler), k -> new ArrayList<>()).add(tcb);
        }
        return byStart;
    }

    private static AbstractInsnNode firstCode(LabelNode label) {
        AbstractInsnNode n = label;
        while (n != null && n.getOpcode() < 0) {
            n = n.getNext();
        }
        return n;
    }

    private BasicBlock blockAt(LabelNode label) {
        BasicBlock block = blockByLeader.get(firstCode(label));
        if (block == null) {
            throw new ClassReadException("jump to a label outside the code");
        }
        return block;
    }

    private BasicBlock fallThrough() {
        int k = blocks.indexOf(current);
        if (k + 1 >= blocks.size()) {
            throw new ClassReadException("conditional jump at the end of the code");
        }
        return blocks.get(k + 1);
    }

    /** Records every stack value that more than one instruction may have produced. */
    private void collectMerges(List<AbstractInsnNode> code) {
        for (AbstractInsnNode n : code) {
            Frame<SourceValue> f = frame(n);
            if (f == null) continue;
            for (int s = 0; s < f.getStackSize(); s++) {
                SourceValue v = f.getStack(s);
                if (v.insns.size() < 2) continue;
                Set<AbstractInsnNode> key = new HashSet<>(v.insns);
                for (AbstractInsnNode producer : v.insns) {
                    List<Set<AbstractInsnNode>> keys = mergesByProducer.computeIfAbsent(producer, k -> new ArrayList<>());
                    if (!keys.contains(key)) keys.add(key);
                }
            }
        }
    }

    // -----------------------------------------------------------------------
    // Parameters and local slots
    // -----------------------------------------------------------------------

    private String functionName() {
        return Type.getObjectType(ownerInternalName).getClassName() + "::" + method.name + method.desc;
    }

    private boolean isStatic() {
        return (method.access & ACC_STATIC) != 0;
    }

    private List<FunctionBuilder.Param> parameters() {
        List<FunctionBuilder.Param> params = new ArrayList<>();
        int local = 0;
        if (!isStatic()) {
            String name = localName(0, IrType.PTR);
            params.add(FunctionBuilder.param(unique(name != null ? name : "this"), IrType.PTR));
            local = 1;
        }
        Type[] args = Type.getArgumentTypes(method.desc);
        for (int k = 0; k < args.length; k++) {
            IrType t = irType(args[k]);
            String name = localName(local, t);
            if (name == null && method.parameters != null && k < method.parameters.size()) {
                name = method.parameters.get(k).name;
            }
            params.add(FunctionBuilder.param(unique(name), t));
            local += args[k].getSize();
        }
        return params;
    }

    private void emitPrologue(List<AbstractInsnNode> code) {
        List<Integer> paramLocals = new ArrayList<>();
        int local = 0;
        if (!isStatic()) {
            paramLocals.add(local++);
        }
        for (Type arg : Type.getArgumentTypes(method.desc)) {
            paramLocals.add(local);
            local += arg.getSize();
        }
        for (int k = 0; k < paramLocals.size(); k++) {
            slot(paramLocals.get(k), b.param(k).type());
        }
        for (AbstractInsnNode n : code) {
            int op = n.getOpcode();
            if (n instanceof VarInsnNode v) {
                slot(v.var, LOCAL_TYPES[op >= ISTORE ? op - ISTORE : op - ILOAD]);
            } else if (n instanceof IincInsnNode inc) {
                slot(inc.var, IrType.I32);
            }
        }
        for (int k = 0; k < paramLocals.size(); k++) {
            Value p = b.param(k);
            b.store(p, slot(paramLocals.get(k), p.type()));
        }
    }

    /** The alloca of local {@code var} used with type {@code type}; created on first use. */
    private Instruction slot(int var, IrType type) {
        String key = var + ":" + type;
        Instruction s = slots.get(key);
        if (s == null) {
            String name = localName(var, type);
            s = allocaInEntry(name != null ? name + ".addr" : null, type);
            slots.put(key, s);
        }
        return s;
    }

    private Instruction tempFor(Set<AbstractInsnNode> key, IrType type) {
        Instruction t = temps.get(key);
        if (t == null) {
            t = allocaInEntry("tmp", type);
            temps.put(key, t);
        }
        return t;
    }

    private Instruction allocaInEntry(String name, IrType type) {
        Instruction anchor = null;
        for (Instruction i : entry.instructions()) {
            if (i.opcode() != Opcode.ALLOCA) {
                anchor = i;
                break;
            }
        }
        if (anchor != null) {
            b.before(anchor);
        } else {
            b.at(entry);
        }
        Instruction a = b.alloca(unique(name), type);
        b.at(current != null ? current : entry);
        return a;
    }

    private String localName(int var, IrType type) {
        if (method.localVariables == null) return null;
        for (LocalVariableNode lv : method.localVariables) {
            if (lv.index == var && irType(Type.getType(lv.desc)) == type) {
                return lv.name;
            }
        }
        return null;
    }

    private String unique(String base) {
        if (base == null) return null;
        if (usedNames.add(base)) return base;
        for (int n = 1; ; n++) {
            if (usedNames.add(base + n)) return base + n;
        }
    }

    // -----------------------------------------------------------------------
    // Operands
    // -----------------------------------------------------------------------

    private Frame<SourceValue> frame(AbstractInsnNode n) {
        return frames[method.instructions.indexOf(n)];
    }

    /** Stack operand {@code depth} places below the top (0 = top) before {@code n} executes. */
    private Value in(Frame<SourceValue> f, int depth) {
        return resolve(f.getStack(f.getStackSize() - 1 - depth));
    }

    private Value resolve(SourceValue v) {
        if (v.insns.size() == 1) {
            Value known = produced.get(v.insns.iterator().next());
            if (known != null) return known;
        } else if (v.insns.size() > 1) {
            Set<AbstractInsnNode> key = new HashSet<>(v.insns);
            Instruction tmp = temps.get(key);
            if (tmp == null) {
                tmp = tempFor(key, v.size == 2 ? IrType.I64 : IrType.I32);
            }
            return b.load(null, tmp.elementType(), tmp);
        }
        return Constant.undef(v.size == 2 ? IrType.I64 : IrType.PTR);
    }

    private void define(AbstractInsnNode producer, Value value) {
        produced.put(producer, value);
        for (Set<AbstractInsnNode> key : mergesByProducer.getOrDefault(producer, List.of())) {
            b.store(value, tempFor(key, value.type()));
        }
    }

    private void emitLandingPad(List<TryCatchBlockNode> caught) {
        String type = caught.get(0).type == null ? null : Type.getObjectType(caught.get(0).type).getClassName();
        Instruction pad = b.landingPad(unique("exn"), type);
        for (TryCatchBlockNode tcb : caught) {
            define(tcb.handler, pad);
        }
    }

    // -----------------------------------------------------------------------
    // Instructions
    // -----------------------------------------------------------------------

    private void translate(AbstractInsnNode n) {
        Frame<SourceValue> f = frame(n);
        if (f == null) {
            translateUnreachable(n);
            return;
        }
        int op = n.getOpcode();
        Value result = null;
        switch (op) {
            case NOP, POP, POP2, DUP, DUP_X1, DUP_X2, DUP2, DUP2_X1, DUP2_X2, SWAP -> { }
            case ACONST_NULL -> result = Constant.nullPointer();
            case ICONST_M1, ICONST_0, ICONST_1, ICONST_2, ICONST_3, ICONST_4, ICONST_5 ->
                    result = Constant.i32(op - ICONST_0);
            case LCONST_0, LCONST_1 -> result = Constant.i64(op - LCONST_0);
            case FCONST_0, FCONST_1, FCONST_2 -> result = Constant.ofFloating(IrType.FLOAT, op - FCONST_0);
            case DCONST_0, DCONST_1 -> result = Constant.ofFloating(IrType.DOUBLE, op - DCONST_0);
            case BIPUSH, SIPUSH -> result = Constant.i32(((IntInsnNode) n).operand);
            case LDC -> result = ldc(((LdcInsnNode) n).cst);
            case ILOAD, LLOAD, FLOAD, DLOAD, ALOAD -> {
                IrType t = LOCAL_TYPES[op - ILOAD];
                result = b.load(null, t, slot(((VarInsnNode) n).var, t));
            }
            case ISTORE, LSTORE, FSTORE, DSTORE, ASTORE ->
                    b.store(in(f, 0), slot(((VarInsnNode) n).var, LOCAL_TYPES[op - ISTORE]));
            case IINC -> {
                IincInsnNode inc = (IincInsnNode) n;
                Instruction s = slot(inc.var, IrType.I32);
                Instruction old = b.load(null, IrType.I32, s);
                b.store(b.add(unique("inc"), old, Constant.i32(inc.incr)), s);
            }
            case IALOAD, LALOAD, FALOAD, DALOAD, AALOAD, BALOAD, CALOAD, SALOAD -> {
                IrType t = ARRAY_TYPES[op - IALOAD];
                Instruction element = b.gep(unique("arrayidx"), t, in(f, 1), in(f, 0));
                result = b.load(null, t, element);
            }
            case IASTORE, LASTORE, FASTORE, DASTORE, AASTORE, BASTORE, CASTORE, SASTORE -> {
                IrType t = ARRAY_TYPES[op - IASTORE];
                Instruction element = b.gep(unique("arrayidx"), t, in(f, 2), in(f, 1));
                b.store(in(f, 0), element);
            }
            case IADD, LADD, FADD, DADD, ISUB, LSUB, FSUB, DSUB, IMUL, LMUL, FMUL, DMUL,
                 IDIV, LDIV, FDIV, DDIV, IREM, LREM, FREM, DREM -> {
                Opcode o = arithmetic((op - IADD) / 4, LOCAL_TYPES[(op - IADD) % 4]);
                result = b.binary(o, unique(o.mnemonic()), in(f, 1), in(f, 0));
            }
            case INEG -> result = b.binary(Opcode.SUB, unique("sub"), Constant.i32(0), in(f, 0));
            case LNEG -> result = b.binary(Opcode.SUB, unique("sub"), Constant.i64(0), in(f, 0));
            case FNEG, DNEG -> result = b.fneg(unique("fneg"), in(f, 0));
            case ISHL, LSHL, ISHR, LSHR, IUSHR, LUSHR -> {
                Opcode o = op <= LSHL ? Opcode.SHL : (op <= LSHR ? Opcode.ASHR : Opcode.LSHR);
                Value amount = in(f, 0);
                if ((op - ISHL) % 2 == 1) {
                    amount = b.cast(Opcode.SEXT, unique("sh_prom"), amount, IrType.I64);
                }
                result = b.binary(o, unique(o.mnemonic()), in(f, 1), amount);
            }
            case IAND, LAND, IOR, LOR, IXOR, LXOR -> {
                Opcode o = op <= LAND ? Opcode.AND : (op <= LOR ? Opcode.OR : Opcode.XOR);
                result = b.binary(o, unique(o.mnemonic()), in(f, 1), in(f, 0));
            }
            case I2L, I2F, I2D, L2I, L2F, L2D, F2I, F2L, F2D, D2I, D2L, D2F, I2B, I2C, I2S ->
                    result = convert(op, in(f, 0));
            case LCMP, FCMPL, FCMPG, DCMPL, DCMPG -> result = b.cmp(unique("cmp"), in(f, 1), in(f, 0));
            case IFEQ, IFNE, IFLT, IFGE, IFGT, IFLE -> conditionalJump((JumpInsnNode) n,
                    b.icmp(unique("cmp"), signedPredicate(op - IFEQ), in(f, 0), Constant.i32(0)));
            case IF_ICMPEQ, IF_ICMPNE, IF_ICMPLT, IF_ICMPGE, IF_ICMPGT, IF_ICMPLE -> conditionalJump((JumpInsnNode) n,
                    b.icmp(unique("cmp"), signedPredicate(op - IF_ICMPEQ), in(f, 1), in(f, 0)));
            case IF_ACMPEQ, IF_ACMPNE -> conditionalJump((JumpInsnNode) n,
                    b.icmp(unique("cmp"), op == IF_ACMPEQ ? Predicate.EQ : Predicate.NE, in(f, 1), in(f, 0)));
            case IFNULL, IFNONNULL -> conditionalJump((JumpInsnNode) n,
                    b.icmp(unique("cmp"), op == IFNULL ? Predicate.EQ : Predicate.NE, in(f, 0), Constant.nullPointer()));
            case GOTO -> b.br(blockAt(((JumpInsnNode) n).label));
            case TABLESWITCH -> {
                TableSwitchInsnNode t = (TableSwitchInsnNode) n;
                Map<Constant, BasicBlock> cases = new LinkedHashMap<>();
                for (int k = 0; k < t.labels.size(); k++) {
                    cases.put(Constant.i32(t.min + k), blockAt(t.labels.get(k)));
                }
                b.switchOn(in(f, 0), blockAt(t.dflt), cases);
            }
            case LOOKUPSWITCH -> {
                LookupSwitchInsnNode l = (LookupSwitchInsnNode) n;
                Map<Constant, BasicBlock> cases = new LinkedHashMap<>();
                for (int k = 0; k < l.keys.size(); k++) {
                    cases.put(Constant.i32(l.keys.get(k)), blockAt(l.labels.get(k)));
                }
                b.switchOn(in(f, 0), blockAt(l.dflt), cases);
            }
            case IRETURN, LRETURN, FRETURN, DRETURN, ARETURN -> b.ret(in(f, 0));
            case RETURN -> b.retVoid();
            case GETSTATIC -> {
                FieldInsnNode fi = (FieldInsnNode) n;
                result = b.loadField(null, irType(Type.getType(fi.desc)), null, field(fi));
            }
            case PUTSTATIC -> b.storeField(in(f, 0), null, field((FieldInsnNode) n));
            case GETFIELD -> {
                FieldInsnNode fi = (FieldInsnNode) n;
                result = b.loadField(null, irType(Type.getType(fi.desc)), in(f, 0), field(fi));
            }
            case PUTFIELD -> b.storeField(in(f, 0), in(f, 1), field((FieldInsnNode) n));
            case INVOKEVIRTUAL, INVOKESPECIAL, INVOKESTATIC, INVOKEINTERFACE -> {
                MethodInsnNode m = (MethodInsnNode) n;
                int argc = Type.getArgumentTypes(m.desc).length + (op == INVOKESTATIC ? 0 : 1);
                result = call(f, argc, Type.getObjectType(m.owner).getClassName() + "::" + m.name + m.desc, m.desc);
            }
            case INVOKEDYNAMIC -> {
                InvokeDynamicInsnNode indy = (InvokeDynamicInsnNode) n;
                result = call(f, Type.getArgumentTypes(indy.desc).length, "invokedynamic." + indy.name + indy.desc, indy.desc);
            }
            case NEW -> result = b.newObject(unique("new"), Type.getObjectType(((TypeInsnNode) n).desc).getClassName());
            case NEWARRAY -> result = b.newObject(unique("newarray"), primitiveArray(((IntInsnNode) n).operand), in(f, 0));
            case ANEWARRAY -> result = b.newObject(unique("newarray"),
                    Type.getObjectType(((TypeInsnNode) n).desc).getClassName() + "[]", in(f, 0));
            case MULTIANEWARRAY -> {
                MultiANewArrayInsnNode m = (MultiANewArrayInsnNode) n;
                Value[] dims = new Value[m.dims];
                for (int k = 0; k < m.dims; k++) {
                    dims[k] = in(f, m.dims - 1 - k);
                }
                result = b.newObject(unique("newarray"), Type.getType(m.desc).getClassName(), dims);
            }
            case ARRAYLENGTH -> result = b.arrayLength(unique("len"), in(f, 0));
            case ATHROW -> b.throwValue(in(f, 0));
            case CHECKCAST -> result = b.cast(Opcode.BITCAST, unique("cast"), in(f, 0), IrType.PTR);
            case INSTANCEOF -> {
                Instruction test = b.instanceOf(unique("isinst"),
                        in(f, 0), Type.getObjectType(((TypeInsnNode) n).desc).getClassName());
                result = b.cast(Opcode.ZEXT, unique("conv"), test, IrType.I32);
            }
            case MONITORENTER, MONITOREXIT ->
                    b.call(null, IrType.VOID, op == MONITORENTER ? "jvm.monitorenter" : "jvm.monitorexit", in(f, 0));
            default -> throw new ClassReadException("unsupported opcode " + op);
        }
        if (result != null) {
            define(n, result);
        }
    }

    /** Keeps the control flow of dead code so block structure and branch ordinals stay intact. */
    private void translateUnreachable(AbstractInsnNode n) {
        int op = n.getOpcode();
        if ((op >= IFEQ && op <= IF_ACMPNE) || op == IFNULL || op == IFNONNULL) {
            conditionalJump((JumpInsnNode) n, Constant.undef(IrType.I1));
        } else if (op == GOTO) {
            b.br(blockAt(((JumpInsnNode) n).label));
        } else if (op == TABLESWITCH) {
            TableSwitchInsnNode t = (TableSwitchInsnNode) n;
            b.switchOn(Constant.undef(IrType.I32), blockAt(t.dflt), Map.of());
        } else if (op == LOOKUPSWITCH) {
            LookupSwitchInsnNode l = (LookupSwitchInsnNode) n;
            b.switchOn(Constant.undef(IrType.I32), blockAt(l.dflt), Map.of());
        } else if (op == RETURN) {
            b.retVoid();
        } else if (op >= IRETURN && op <= ARETURN) {
            b.ret(Constant.undef(irType(Type.getReturnType(method.desc))));
        } else if (op == ATHROW) {
            b.throwValue(Constant.undef(IrType.PTR));
        }
    }

    private void conditionalJump(JumpInsnNode jump, Value condition) {
        b.condBr(condition, blockAt(jump.label), fallThrough());
    }

    private Value call(Frame<SourceValue> f, int argc, String callee, String desc) {
        List<Value> args = new ArrayList<>();
        for (int k = 0; k < argc; k++) {
            args.add(in(f, argc - 1 - k));
        }
        IrType returnType = irType(Type.getReturnType(desc));
        Instruction c = b.call(returnType == IrType.VOID ? null : unique("call"), returnType, callee, args);
        return returnType == IrType.VOID ? null : c;
    }

    private Value convert(int op, Value v) {
        return switch (op) {
            case I2L -> b.cast(Opcode.SEXT, unique("conv"), v, IrType.I64);
            case I2F, L2F -> b.cast(Opcode.SITOFP, unique("conv"), v, IrType.FLOAT);
            case I2D, L2D -> b.cast(Opcode.SITOFP, unique("conv"), v, IrType.DOUBLE);
            case L2I -> b.cast(Opcode.TRUNC, unique("conv"), v, IrType.I32);
            case F2I, D2I -> b.cast(Opcode.FPTOSI, unique("conv"), v, IrType.I32);
            case F2L, D2L -> b.cast(Opcode.FPTOSI, unique("conv"), v, IrType.I64);
            case F2D -> b.cast(Opcode.FPEXT, unique("conv"), v, IrType.DOUBLE);
            case D2F -> b.cast(Opcode.FPTRUNC, unique("conv"), v, IrType.FLOAT);
            case I2B -> b.cast(Opcode.SEXT, unique("conv"), b.cast(Opcode.TRUNC, unique("conv"), v, IrType.I8), IrType.I32);
            case I2C -> b.cast(Opcode.ZEXT, unique("conv"), b.cast(Opcode.TRUNC, unique("conv"), v, IrType.I16), IrType.I32);
            case I2S -> b.cast(Opcode.SEXT, unique("conv"), b.cast(Opcode.TRUNC, unique("conv"), v, IrType.I16), IrType.I32);
            default -> throw new IllegalStateException("not a conversion: " + op);
        };
    }

    private static Opcode arithmetic(int kind, IrType type) {
        boolean fp = type.isFloating();
        return switch (kind) {
            case 0 -> fp ? Opcode.FADD : Opcode.ADD;
            case 1 -> fp ? Opcode.FSUB : Opcode.SUB;
            case 2 -> fp ? Opcode.FMUL : Opcode.MUL;
            case 3 -> fp ? Opcode.FDIV : Opcode.SDIV;
            default -> fp ? Opcode.FREM : Opcode.SREM;
        };
    }

    /** Order of IFEQ..IFLE and IF_ICMPEQ..IF_ICMPLE. */
    private static Predicate signedPredicate(int index) {
        return switch (index) {
            case 0 -> Predicate.EQ;
            case 1 -> Predicate.NE;
            case 2 -> Predicate.SLT;
            case 3 -> Predicate.SGE;
            case 4 -> Predicate.SGT;
            default -> Predicate.SLE;
        };
    }

    private static Constant ldc(Object cst) {
        if (cst instanceof Integer i) return Constant.i32(i);
        if (cst instanceof Long l) return Constant.i64(l);
        if (cst instanceof Float fl) return Constant.ofFloating(IrType.FLOAT, fl);
        if (cst instanceof Double d) return Constant.ofFloating(IrType.DOUBLE, d);
        if (cst instanceof String s) return Constant.string(s);
        if (cst instanceof Type t) {
            return t.getSort() == Type.METHOD ? Constant.symbol(t.getDescriptor()) : Constant.symbol(t.getClassName() + ".class");
        }
        if (cst instanceof Handle h) {
            return Constant.symbol(Type.getObjectType(h.getOwner()).getClassName() + "::" + h.getName() + h.getDesc());
        }
        if (cst instanceof ConstantDynamic cd) return Constant.symbol(cd.getName());
        return Constant.symbol(String.valueOf(cst));
    }

    private static String field(FieldInsnNode fi) {
        return Type.getObjectType(fi.owner).getClassName() + "." + fi.name;
    }

    private static String primitiveArray(int type) {
        return switch (type) {
            case T_BOOLEAN -> "boolean[]";
            case T_CHAR -> "char[]";
            case T_FLOAT -> "float[]";
            case T_DOUBLE -> "double[]";
            case T_BYTE -> "byte[]";
            case T_SHORT -> "short[]";
            case T_LONG -> "long[]";
            default -> "int[]";
        };
    }

    /** JVM computational type: sub-int integers are {@code i32}. */
    static IrType irType(Type t) {
        return switch (t.getSort()) {
            case Type.VOID -> IrType.VOID;
            case Type.BOOLEAN, Type.BYTE, Type.CHAR, Type.SHORT, Type.INT -> IrType.I32;
            case Type.LONG -> IrType.I64;
            case Type.FLOAT -> IrType.FLOAT;
            case Type.DOUBLE -> IrType.DOUBLE;
            default -> IrType.PTR;
        };
    }
}
