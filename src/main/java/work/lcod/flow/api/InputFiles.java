package work.lcod.flow.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Loads program input from a file. JSON and YAML must hold an object; CSV uses its first row as
 * header, and a single data row becomes a flat record while several become {@code {rows, count}}.
 */
public final class InputFiles {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final List<String> SUPPORTED = List.of(".json", ".yaml", ".yml", ".csv");
    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");

    private InputFiles() {}

    public static Map<String, Object> load(Path file) {
        String extension = extensionOf(file);
        if (!SUPPORTED.contains(extension)) {
            throw new IllegalArgumentException("Unsupported file type \"" + extension + "\". Supported types: "
                + String.join(", ", SUPPORTED));
        }
        try {
            switch (extension) {
                case ".json":
                    return readObject(JSON, file);
                case ".yaml":
                case ".yml":
                    return readObject(YAML, file);
                default:
                    return readCsv(file);
            }
        } catch (IOException ex) {
            throw new IllegalArgumentException("Cannot read input file " + file + ": " + ex.getMessage(), ex);
        }
    }

    /** Parses a JSON object given inline, e.g. with {@code --input}. */
    public static Map<String, Object> parseJson(String payload) {
        if (payload == null || payload.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            var node = JSON.readTree(payload);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("The input must be a JSON object");
            }
            return JSON.convertValue(node, MAP_TYPE);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON input: " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> readObject(ObjectMapper mapper, Path file) throws IOException {
        var node = mapper.readTree(file.toFile());
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("The input file " + file.getFileName() + " must contain an object");
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    private static Map<String, Object> readCsv(Path file) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim())) {
            List<String> headers = parser.getHeaderNames();
            for (CSVRecord record : parser) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (String header : headers) {
                    if (record.isSet(header) && !record.get(header).isEmpty()) {
                        row.put(header, typed(record.get(header)));
                    }
                }
                rows.add(row);
            }
        }
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("The file has no data rows.");
        }
        if (rows.size() == 1) {
            return rows.get(0);
        }
        Map<String, Object> table = new LinkedHashMap<>();
        table.put("rows", rows);
        table.put("count", rows.size());
        return table;
    }

    static Object typed(String cell) {
        if ("true".equalsIgnoreCase(cell)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(cell)) {
            return Boolean.FALSE;
        }
        if (INTEGER.matcher(cell).matches()) {
            return Long.parseLong(cell);
        }
        if (DECIMAL.matcher(cell).matches()) {
            return Double.parseDouble(cell);
        }
        return cell;
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
