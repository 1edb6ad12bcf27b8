package com.raditha.merge.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.merge.model.Decision;
import com.raditha.merge.result.MergeResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exports merge statistics to JSON.
 */
public class StatisticsExporter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Summary of one merge.
     *
     * @param template     template file name
     * @param destination  destination file name
     * @param totalLines   lines in the merged output
     * @param changed      whether the output differs from the destination
     * @param decisions    lines per decision label, every decision listed
     */
    public record MergeStatistics(
            String template,
            String destination,
            int totalLines,
            boolean changed,
            Map<String, Integer> decisions) {
    }

    public MergeStatistics buildStatistics(String template, String destination, MergeResult result,
            String originalDestination) {
        Map<String, Integer> decisions = new LinkedHashMap<>();
        Map<Decision, Integer> counts = result.statistics();
        for (Decision decision : Decision.values()) {
            decisions.put(decision.label(), counts.getOrDefault(decision, 0));
        }
        return new MergeStatistics(template, destination, result.size(),
                !result.content().equals(originalDestination), decisions);
    }

    public String toJson(MergeStatistics statistics) throws IOException {
        return mapper.writeValueAsString(statistics);
    }

    /**
     * Export statistics to a JSON file.
     */
    public void exportToJson(MergeStatistics statistics, Path outputPath) throws IOException {
        Files.writeString(outputPath, toJson(statistics));
    }
}
