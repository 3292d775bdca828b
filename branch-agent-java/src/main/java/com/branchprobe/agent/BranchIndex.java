package com.branchprobe.agent;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe record of every conditional jump the agent has probed, keyed by branch ID.
 *
 * The ordinal of a site is its position among the conditional jumps of its method, which
 * is the ID the static extractor assigns to the same branch when it runs with per-function
 * scope over the same bytecode. This is what joins dynamic outcomes to static features.
 */
public class BranchIndex {

    private final ConcurrentHashMap<Long, Site> sites = new ConcurrentHashMap<>();

    public void record(long branchId, String owner, String method, String descriptor, int ordinal) {
        Site site = new Site();
        site.branchId = branchId;
        site.owner = owner;
        site.method = method;
        site.descriptor = descriptor;
        site.ordinal = ordinal;
        sites.putIfAbsent(branchId, site);
    }

    public Site get(long branchId) {
        return sites.get(branchId);
    }

    public int size() {
        return sites.size();
    }

    /** All sites, sorted by branch ID. */
    public List<Site> sites() {
        List<Site> sorted = new ArrayList<>(sites.values());
        sorted.sort(Comparator.comparingLong(s -> s.branchId));
        return sorted;
    }

    public void clear() {
        sites.clear();
    }

    /** One probed conditional jump; also the JSON shape written by {@link ShutdownHook}. */
    public static class Site {
        @SerializedName("branch_id")  public long branchId;
        @SerializedName("owner")      public String owner;
        @SerializedName("method")     public String method;
        @SerializedName("descriptor") public String descriptor;
        @SerializedName("ordinal")    public int ordinal;

        /** {@code owner::method(descriptor)}, the function name the class-file reader uses. */
        public String functionName() {
            return owner + "::" + method + descriptor;
        }
    }

    /** Top-level JSON document. */
    public static class Document {
        @SerializedName("program")  public String program;
        @SerializedName("branches") public List<Site> branches;
    }
}
