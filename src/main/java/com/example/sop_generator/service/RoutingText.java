package com.example.sop_generator.service;

import com.example.sop_generator.model.FlowTarget;
import com.example.sop_generator.model.TargetKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/** Phrases shared by task rows and gateway cases. */
final class RoutingText {

    private RoutingText() {}

    /** A target at or before the current step is a revert, self-loops included. */
    static boolean isRevert(int target, int current) {
        return target <= current;
    }

    static String verb(int target, int current) {
        return isRevert(target, current) ? "Revert" : "Proceed";
    }

    /** "3 and Step 5" for connector " and Step ". */
    static String steps(Collection<Integer> steps, String connector) {
        return steps.stream().map(String::valueOf).collect(Collectors.joining(connector));
    }

    static String processEnds(String endName) {
        return "Process Ends (" + endName + ")";
    }

    /** Step numbers of the task targets, ascending. */
    static List<Integer> taskSteps(List<FlowTarget> targets) {
        List<Integer> out = new ArrayList<>();
        for (FlowTarget t : targets) if (t.is(TargetKind.TASK)) out.add(t.getStep());
        out.sort(null);
        return out;
    }

    static FlowTarget first(List<FlowTarget> targets) {
        return targets.isEmpty() ? null : targets.get(0);
    }

    static boolean startsWithIgnoreCase(String s, String prefix) {
        return s.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    /** Appends "." unless the text already ends with terminal punctuation. */
    static String ensurePeriod(String text) {
        String t = text.stripTrailing();
        if (!t.isEmpty() && !(t.endsWith(".") || t.endsWith("!") || t.endsWith("?"))) t += ".";
        return t;
    }
}
