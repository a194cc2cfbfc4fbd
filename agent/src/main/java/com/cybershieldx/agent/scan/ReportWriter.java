package com.cybershieldx.agent.scan;

import com.cybershieldx.agent.model.AgentIdentity;
import com.cybershieldx.agent.util.Jsons;
import com.cybershieldx.agent.util.SanitizeUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Builds scan reports and stores them under the reports directory
 */
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    /** Severities counted in the report summary, most severe first */
    static final String[] SEVERITIES = {"critical", "high", "medium", "low"};

    private static final String[] SYSTEM_DETAIL_FIELDS = {
            "hostname", "platform", "arch", "osName", "osVersion", "cpus", "maxMemory", "uptimeSeconds"};

    private final Path reportsDir;

    public ReportWriter(Path reportsDir) {
        this.reportsDir = reportsDir;
    }

    public ObjectNode build(String scanId, ScanType type, AgentIdentity identity,
            ObjectNode sections, Instant timestamp) {
        ObjectNode report = Jsons.object();
        report.put("reportId", UUID.randomUUID().toString());
        report.put("scanId", scanId);
        report.put("scanType", type.wireName());
        report.put("timestamp", timestamp.toString());
        report.set("agent", identity.toJson());
        ObjectNode sanitized = sections.deepCopy();
        maskMacAddresses(sanitized);
        report.set("summary", summarize(sanitized));
        report.set("systemDetails", systemDetails(sanitized));
        report.set("results", sanitized);
        return report;
    }

    /**
     * Issue counts per severity, the resulting risk level and overall status.
     * Issues are the elements of any {@code issues} array in the scan sections.
     */
    static ObjectNode summarize(JsonNode sections) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String severity : SEVERITIES) {
            counts.put(severity, 0);
        }
        countIssues(sections, counts);

        ObjectNode issueCount = Jsons.object();
        int total = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            issueCount.put(entry.getKey(), entry.getValue());
            total += entry.getValue();
        }
        issueCount.put("total", total);

        ObjectNode summary = Jsons.object();
        summary.put("riskLevel", riskLevel(counts));
        summary.set("issueCount", issueCount);
        summary.put("overallStatus", overallStatus(counts));
        return summary;
    }

    private static void countIssues(JsonNode node, Map<String, Integer> counts) {
        if (node instanceof ObjectNode) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if ("issues".equals(field.getKey()) && field.getValue().isArray()) {
                    for (JsonNode issue : field.getValue()) {
                        String severity = issue.path("severity").asText("").toLowerCase(Locale.ROOT);
                        counts.computeIfPresent(severity, (key, count) -> count + 1);
                    }
                } else {
                    countIssues(field.getValue(), counts);
                }
            }
        } else if (node instanceof ArrayNode) {
            for (JsonNode element : node) {
                countIssues(element, counts);
            }
        }
    }

    private static String riskLevel(Map<String, Integer> counts) {
        if (counts.get("critical") > 0 || counts.get("high") > 0) {
            return "high";
        }
        return counts.get("medium") > 0 ? "medium" : "low";
    }

    private static String overallStatus(Map<String, Integer> counts) {
        if (counts.get("critical") > 0) {
            return "critical";
        } else if (counts.get("high") > 0) {
            return "at risk";
        } else if (counts.get("medium") > 0) {
            return "warning";
        } else if (counts.get("low") > 0) {
            return "good";
        }
        return "excellent";
    }

    private static ObjectNode systemDetails(JsonNode sections) {
        ObjectNode details = Jsons.object();
        JsonNode system = sections.path("system");
        for (String field : SYSTEM_DETAIL_FIELDS) {
            JsonNode value = system.get(field);
            if (value != null && value.isValueNode()) {
                details.set(field, value);
            }
        }
        return details;
    }

    public Path save(ObjectNode report) throws IOException {
        String scanId = SanitizeUtils.sanitizeForPath(report.path("scanId").asText());
        Path file = reportsDir.resolve("report-" + scanId + "-" + System.currentTimeMillis() + ".json");
        Jsons.writeAtomically(file, report);
        log.info("Scan report saved to {}", file);
        return file;
    }

    // Any string field whose name mentions "mac" is treated as a hardware address
    static void maskMacAddresses(JsonNode node) {
        if (node instanceof ObjectNode) {
            ObjectNode object = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isTextual() && field.getKey().toLowerCase(Locale.ROOT).contains("mac")) {
                    field.setValue(TextNode.valueOf(SanitizeUtils.maskMacAddress(value.asText())));
                } else {
                    maskMacAddresses(value);
                }
            }
        } else if (node instanceof ArrayNode) {
            for (JsonNode element : node) {
                maskMacAddresses(element);
            }
        }
    }
}
