package com.coursereq.graph;

import com.coursereq.graph.CourseGraphModels.GraphLink;
import com.coursereq.graph.CourseGraphModels.GraphNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Node and link tables in the CSV layout the visualization tooling reads.
 */
@Component
public class GraphCsvCodec {
    public static final String NODE_HEADER = "id,title,group,size,depth";
    public static final String LINK_HEADER = "source,target,value";

    public String writeNodes(List<GraphNode> nodes) {
        List<String> rows = new ArrayList<>();
        rows.add(NODE_HEADER);
        nodes.forEach(n -> rows.add(String.join(",",
                escape(n.id()), escape(n.title()), escape(n.group()), number(n.size()), Integer.toString(n.depth()))));
        return String.join("\n", rows);
    }

    public String writeLinks(List<GraphLink> links) {
        List<String> rows = new ArrayList<>();
        rows.add(LINK_HEADER);
        links.forEach(l -> rows.add(String.join(",", escape(l.source()), escape(l.target()), number(l.value()))));
        return String.join("\n", rows);
    }

    public List<GraphNode> readNodes(String csv) {
        return records(csv, NODE_HEADER).stream()
                .map(f -> new GraphNode(f.get(0), f.get(1), f.get(2), Double.parseDouble(f.get(3)), Integer.parseInt(f.get(4))))
                .toList();
    }

    public List<GraphLink> readLinks(String csv) {
        return records(csv, LINK_HEADER).stream()
                .map(f -> new GraphLink(f.get(0), f.get(1), Double.parseDouble(f.get(2))))
                .toList();
    }

    private List<List<String>> records(String csv, String header) {
        List<List<String>> rows = split(csv);
        if (rows.isEmpty()) return List.of();

        String actualHeader = String.join(",", rows.get(0));
        if (!header.equals(actualHeader)) {
            throw new IllegalArgumentException("Expected CSV header '" + header + "', got '" + actualHeader + "'");
        }
        int width = rows.get(0).size();
        List<List<String>> records = rows.subList(1, rows.size());
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).size() != width) {
                throw new IllegalArgumentException("CSV row " + (i + 2) + " has " + records.get(i).size() + " fields, expected " + width);
            }
        }
        return records;
    }

    // RFC 4180 style: quoted fields may hold commas, doubled quotes and line breaks
    private List<List<String>> split(String csv) {
        List<List<String>> rows = new ArrayList<>();
        if (csv == null || csv.isEmpty()) return rows;

        List<String> row = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < csv.length(); i++) {
            char c = csv.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < csv.length() && csv.charAt(i + 1) == '"') {
                    field.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                row.add(field.toString());
                field.setLength(0);
            } else if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < csv.length() && csv.charAt(i + 1) == '\n') i++;
                row.add(field.toString());
                field.setLength(0);
                if (!isBlankLine(row)) rows.add(row);
                row = new ArrayList<>();
            } else {
                field.append(c);
            }
        }
        if (field.length() > 0 || !row.isEmpty()) {
            row.add(field.toString());
            rows.add(row);
        }
        return rows;
    }

    private static boolean isBlankLine(List<String> row) {
        return row.size() == 1 && row.get(0).isEmpty();
    }

    private static String escape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
