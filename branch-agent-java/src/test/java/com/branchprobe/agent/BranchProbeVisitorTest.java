package com.branchprobe.agent;

import com.branchprobe.agent.fixture.Thresholds;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BranchProbeVisitorTest {

    private RecordingSink sink;
    private BranchIdSequence ids;
    private BranchIndex index;
    private Class<?> probed;

    @BeforeEach
    void instrumentFixture() {
        BranchLog.reset();
        sink = new RecordingSink();
        BranchLog.install(sink);

        ids = new BranchIdSequence();
        index = new BranchIndex();
        probed = new ByteBuddy()
            .redefine(Thresholds.class)
            .name(Thresholds.class.getName() + "Probed")
            .visit(AgentBootstrap.probeWrapper(ids, index))
            .make()
            .load(Thresholds.class.getClassLoader(), ClassLoadingStrategy.Default.WRAPPER)
            .getLoaded();
    }

    @AfterEach
    void reset() {
        BranchLog.reset();
    }

    private List<BranchIndex.Site> sitesOf(String method) {
        return index.sites().stream()
            .filter(s -> s.method.equals(method))
            .collect(Collectors.toList());
    }

    private Object call(String name, Class<?>[] types, Object... args) throws Exception {
        Method m = probed.getMethod(name, types);
        return m.invoke(null, args);
    }

    // --- Branch index ---

    @Test
    void everyConditionalJumpIsIndexedOnce() {
        assertEquals(2, sitesOf("sign").size());
        assertEquals(2, sitesOf("countAbove").size());
        assertEquals(1, sitesOf("describe").size());
        assertEquals(1, sitesOf("same").size());
        assertTrue(sitesOf("straightLine").isEmpty());
        assertEquals(ids.peek(), index.size(), "IDs must be dense from 0");
    }

    @Test
    void ordinalsRestartPerMethod() {
        List<BranchIndex.Site> sign = sitesOf("sign");
        assertEquals(0, sign.get(0).ordinal);
        assertEquals(1, sign.get(1).ordinal);
        assertEquals(sign.get(0).branchId + 1, sign.get(1).branchId);
        assertEquals("(I)I", sign.get(0).descriptor);
        assertEquals(Thresholds.class.getName() + "Probed::sign(I)I", sign.get(0).functionName());
    }

    // --- Recorded outcomes ---

    @Test
    void positiveInputFallsThroughFirstJump() throws Exception {
        // javac compiles "if (x > 0)" to IFLE, so the jump is not taken for x = 5
        assertEquals(1, call("sign", new Class<?>[]{int.class}, 5));
        long first = sitesOf("sign").get(0).branchId;
        assertEquals(List.of(new RecordingSink.Event(first, false)), sink.events);
    }

    @Test
    void negativeInputTakesFirstJumpThenFallsThrough() throws Exception {
        assertEquals(-1, call("sign", new Class<?>[]{int.class}, -3));
        List<BranchIndex.Site> sites = sitesOf("sign");
        assertEquals(List.of(
            new RecordingSink.Event(sites.get(0).branchId, true),
            new RecordingSink.Event(sites.get(1).branchId, false)
        ), sink.events);
    }

    @Test
    void loopRecordsEveryIteration() throws Exception {
        Object result = call("countAbove", new Class<?>[]{int[].class, int.class}, new int[]{1, 5, 9}, 4);
        assertEquals(2, result, "Probes must not change the method's result");
        // 4 loop tests + 3 element tests
        assertEquals(7, sink.events.size());
    }

    @Test
    void referenceComparisonsAreProbed() throws Exception {
        assertEquals("none", call("describe", new Class<?>[]{Object.class}, (Object) null));
        assertEquals("some", call("describe", new Class<?>[]{Object.class}, "x"));
        long site = sitesOf("describe").get(0).branchId;
        // IFNONNULL: not taken for null, taken otherwise
        assertEquals(List.of(
            new RecordingSink.Event(site, false),
            new RecordingSink.Event(site, true)
        ), sink.events);

        Object o = new Object();
        assertEquals(true, call("same", new Class<?>[]{Object.class, Object.class}, o, o));
        assertEquals(false, call("same", new Class<?>[]{Object.class, Object.class}, o, "other"));
    }

    @Test
    void methodWithoutBranchesLogsNothing() throws Exception {
        assertEquals(7, call("straightLine", new Class<?>[]{int.class, int.class}, 2, 3));
        assertTrue(sink.events.isEmpty());
    }
}
