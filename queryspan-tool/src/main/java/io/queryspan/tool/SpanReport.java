package io.queryspan.tool;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

import io.queryspan.span.HintSet;
import io.queryspan.span.QuerySpan;

/**
 * Json view of the span of one query.
 */
public class SpanReport {
    @JsonProperty("query")
    public final String query;
    @JsonProperty("fetches")
    public final int fetches;
    @JsonProperty("rounds")
    public final int rounds;
    @JsonProperty("hintSets")
    public final List<Entry> hintSets;

    public SpanReport(String query, QuerySpan span) {
        this.query = query;
        this.fetches = span.fetchCount();
        this.rounds = span.roundCount();
        this.hintSets = new ArrayList<>(span.size());
        for (HintSet hintSet : span) {
            hintSets.add(new Entry(hintSet));
        }
    }

    public static class Entry {
        @JsonProperty("key")
        public final String key;
        @JsonProperty("knobs")
        public final List<String> knobs;
        @JsonProperty("dependency")
        public final String dependency;
        @JsonProperty("required")
        public final boolean required;
        @JsonProperty("planHash")
        public final long planHash;

        Entry(HintSet hintSet) {
            this.key = hintSet.toString();
            this.knobs = new ArrayList<>(hintSet.knobs());
            this.dependency = hintSet.dependency() == null ? null : hintSet.dependency().toString();
            this.required = hintSet.isRequired();
            this.planHash = hintSet.planHash();
        }
    }
}
