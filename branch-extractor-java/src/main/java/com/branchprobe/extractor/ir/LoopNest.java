package com.branchprobe.extractor.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loop-nest tree of one function, computed once from its CFG and read-only afterwards.
 *
 * Dominators come from the iterative algorithm of Cooper, Harvey and Kennedy over reverse
 * postorder. Every edge {@code n -> h} where {@code h} dominates {@code n} is a back edge; its
 * natural loop is {@code h} plus every block that reaches {@code n} without passing through
 * {@code h}. Back edges sharing a header form one loop. Loops nest by containment. Blocks not
 * reachable from the entry belong to no loop.
 */
public class LoopNest {

    private final List<Loop> topLevel;
    private final Map<BasicBlock, Loop> innermost;

    private LoopNest(List<Loop> topLevel, Map<BasicBlock, Loop> innermost) {
        this.topLevel = topLevel;
        this.innermost = innermost;
    }

    /** Outermost loops, ordered by header position. */
    public List<Loop> topLevelLoops() {
        return topLevel;
    }

    /** Innermost loop containing {@code block}, or null. */
    public Loop loopFor(BasicBlock block) {
        return innermost.get(block);
    }

    /** Depth of the innermost loop containing {@code block}, 0 outside loops. */
    public int depth(BasicBlock block) {
        Loop l = innermost.get(block);
        return l == null ? 0 : l.depth();
    }

    public static LoopNest compute(Function function) {
        List<BasicBlock> rpo = reversePostOrder(function.entry());
        Map<BasicBlock, Integer> order = new HashMap<>();
        for (int i = 0; i < rpo.size(); i++) order.put(rpo.get(i), i);
        Map<BasicBlock, BasicBlock> idom = dominators(rpo, order);

        // header -> body, headers in function order
        Map<BasicBlock, Set<BasicBlock>> bodies = new LinkedHashMap<>();
        for (BasicBlock n : rpo) {
            for (BasicBlock h : n.successors()) {
                if (order.containsKey(h) && dominates(h, n, idom)) {
                    Set<BasicBlock> body = bodies.computeIfAbsent(h, k -> new HashSet<>());
                    collectBody(h, n, body, order);
                }
            }
        }

        List<Loop> loops = new ArrayList<>();
        for (Map.Entry<BasicBlock, Set<BasicBlock>> e : bodies.entrySet()) {
            List<BasicBlock> ordered = new ArrayList<>();
            for (BasicBlock b : function.blocks()) {
                if (e.getValue().contains(b)) ordered.add(b);
            }
            loops.add(new Loop(e.getKey(), ordered));
        }

        // Parent = smallest strictly larger loop containing the header.
        List<Loop> bySize = new ArrayList<>(loops);
        bySize.sort(Comparator.comparingInt((Loop l) -> l.blocks().size()).thenComparingInt(l -> l.header().index()));
        List<Loop> topLevel = new ArrayList<>();
        for (int i = 0; i < bySize.size(); i++) {
            Loop inner = bySize.get(i);
            Loop parent = null;
            for (int j = i + 1; j < bySize.size() && parent == null; j++) {
                Loop candidate = bySize.get(j);
                if (candidate.blocks().size() > inner.blocks().size() && candidate.contains(inner.header())) {
                    parent = candidate;
                }
            }
            if (parent == null) {
                topLevel.add(inner);
            } else {
                inner.setParent(parent);
            }
        }

        for (Loop l : loops) {
            l.sortSubLoops();
        }

        // Depths, outermost first.
        Deque<Loop> work = new ArrayDeque<>(topLevel);
        while (!work.isEmpty()) {
            Loop l = work.pop();
            l.setDepth(l.parent() == null ? 1 : l.parent().depth() + 1);
            for (Loop s : l.subLoops()) work.push(s);
        }

        Map<BasicBlock, Loop> innermost = new HashMap<>();
        for (Loop l : loops) {
            for (BasicBlock b : l.blocks()) {
                Loop current = innermost.get(b);
                if (current == null || l.depth() > current.depth()) {
                    innermost.put(b, l);
                }
            }
        }

        topLevel.sort(Comparator.comparingInt(l -> l.header().index()));
        return new LoopNest(Collections.unmodifiableList(topLevel), innermost);
    }

    private static void collectBody(BasicBlock header, BasicBlock latch, Set<BasicBlock> body,
                                    Map<BasicBlock, Integer> reachable) {
        body.add(header);
        Deque<BasicBlock> work = new ArrayDeque<>();
        if (body.add(latch)) {
            work.push(latch);
        }
        while (!work.isEmpty()) {
            BasicBlock b = work.pop();
            for (BasicBlock p : b.predecessors()) {
                if (reachable.containsKey(p) && body.add(p)) {
                    work.push(p);
                }
            }
        }
    }

    private static List<BasicBlock> reversePostOrder(BasicBlock entry) {
        List<BasicBlock> post = new ArrayList<>();
        Set<BasicBlock> visited = new HashSet<>();
        // Iterative DFS: each frame is a block and the index of its next successor.
        Deque<Object[]> stack = new ArrayDeque<>();
        visited.add(entry);
        stack.push(new Object[]{entry, 0});
        while (!stack.isEmpty()) {
            Object[] frame = stack.peek();
            BasicBlock b = (BasicBlock) frame[0];
            List<BasicBlock> succs = b.successors();
            int next = (Integer) frame[1];
            if (next < succs.size()) {
                frame[1] = next + 1;
                BasicBlock s = succs.get(next);
                if (visited.add(s)) {
                    stack.push(new Object[]{s, 0});
                }
            } else {
                stack.pop();
                post.add(b);
            }
        }
        Collections.reverse(post);
        return post;
    }

    private static Map<BasicBlock, BasicBlock> dominators(List<BasicBlock> rpo, Map<BasicBlock, Integer> order) {
        Map<BasicBlock, BasicBlock> idom = new HashMap<>();
        BasicBlock entry = rpo.get(0);
        idom.put(entry, entry);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 1; i < rpo.size(); i++) {
                BasicBlock b = rpo.get(i);
                BasicBlock newIdom = null;
                for (BasicBlock p : b.predecessors()) {
                    if (!idom.containsKey(p)) continue;
                    newIdom = newIdom == null ? p : intersect(p, newIdom, idom, order);
                }
                if (newIdom != null && idom.get(b) != newIdom) {
                    idom.put(b, newIdom);
                    changed = true;
                }
            }
        }
        return idom;
    }

    private static BasicBlock intersect(BasicBlock a, BasicBlock b, Map<BasicBlock, BasicBlock> idom,
                                        Map<BasicBlock, Integer> order) {
        while (a != b) {
            while (order.get(a) > order.get(b)) a = idom.get(a);
            while (order.get(b) > order.get(a)) b = idom.get(b);
        }
        return a;
    }

    private static boolean dominates(BasicBlock h, BasicBlock n, Map<BasicBlock, BasicBlock> idom) {
        BasicBlock cur = n;
        while (true) {
            if (cur == h) return true;
            BasicBlock up = idom.get(cur);
            if (up == null || up == cur) return false;
            cur = up;
        }
    }
}
