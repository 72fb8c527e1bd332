package com.example.sop_generator.service;

import com.example.sop_generator.dto.SlaMerge;
import com.example.sop_generator.dto.StepRecord;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans the merged SLA cells of the step table. Ranges are disjoint and ascending;
 * every range starts at a task row and runs over its trailing gateway-case rows.
 */
@Service
public class SlaMergeService {

    public List<SlaMerge> plan(List<StepRecord> steps) {
        List<SlaMerge> merges = new ArrayList<>();
        int idx = 0;
        while (idx < steps.size()) {
            StepRecord row = steps.get(idx);
            String sla = row.getSla();
            String group = row.getSlaGroup();

            if (group == null && sla != null && !sla.isEmpty()) {
                int end = skipCases(steps, idx + 1) - 1;
                merges.add(new SlaMerge(idx, end, sla));
                idx = end + 1;
            } else if (group != null) {
                int j = skipCases(steps, idx + 1);
                while (j < steps.size() && group.equals(steps.get(j).getSlaGroup())) {
                    j = skipCases(steps, j + 1);
                }
                merges.add(new SlaMerge(idx, j - 1, sla));
                idx = j;
            } else {
                idx = skipCases(steps, idx + 1);
            }
        }
        return merges;
    }

    /** Index of the first row at or after {@code from} that is not a gateway case. */
    private static int skipCases(List<StepRecord> steps, int from) {
        int j = from;
        while (j < steps.size() && steps.get(j).isGatewayCase()) j++;
        return j;
    }
}
