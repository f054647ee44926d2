package io.github.yok.sqlmodelrunner.parser;

import io.github.yok.sqlmodelrunner.exception.ModelParseException;
import io.github.yok.sqlmodelrunner.model.Materialization;
import io.github.yok.sqlmodelrunner.model.Model;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Parses the text of one model file into a {@link Model}.
 *
 * <h2>File layout</h2>
 *
 * <pre>
 * -- name: int_orders
 * -- materialized: incremental
 * -- partition_by: order_date
 * -- depends_on: stg_customers, stg_orders
 *
 * SELECT ... FROM {stg_orders} o JOIN {stg_customers} c ON ...
 * </pre>
 *
 * <p>
 * The header block is the leading run of blank lines and {@code -- key: value} lines. The first
 * line that is neither (a SQL line or a free-form comment) starts the body, which is kept
 * verbatim.
 * </p>
 *
 * <h2>Rules</h2>
 *
 * <ul>
 * <li>Recognized keys: {@code name}, {@code materialized}, {@code partition_by},
 * {@code depends_on}. Keys are case-insensitive.</li>
 * <li>Unrecognized keys are ignored so that newer model files keep working. A leading comment that
 * happens to look like {@code -- word: text} (for example {@code -- Note: rebuilt nightly}) is read
 * as such a key and dropped from the body; a comment without a colon ends the header and stays in
 * the body.</li>
 * <li>{@code materialized} defaults to {@code view}; values other than {@code view},
 * {@code table}, {@code incremental} are rejected.</li>
 * <li>Without {@code name}, the file base name (extension removed) is used.</li>
 * <li>A recognized key declared twice, a blank {@code name}, or an empty body is rejected.</li>
 * </ul>
 *
 * <p>
 * This class performs no I/O; see {@link ModelLoader} for directory scanning.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ModelParser {

    static final String KEY_NAME = "name";
    static final String KEY_MATERIALIZED = "materialized";
    static final String KEY_PARTITION_BY = "partition_by";
    static final String KEY_DEPENDS_ON = "depends_on";

    private static final Set<String> RECOGNIZED_KEYS =
            Set.of(KEY_NAME, KEY_MATERIALIZED, KEY_PARTITION_BY, KEY_DEPENDS_ON);

    // "-- key: value" (value may be empty)
    private static final Pattern HEADER_LINE =
            Pattern.compile("^--\\s*([A-Za-z_][A-Za-z0-9_-]*)\\s*:(.*)$");

    private static final char BOM = '\uFEFF';

    /**
     * Parses one model file.
     *
     * @param text full file content
     * @param sourcePath file path, used for the derived name and for error messages
     * @return parsed model
     * @throws ModelParseException if the header or body is invalid
     */
    public Model parse(String text, String sourcePath) {
        Validate.notNull(text, "text must not be null.");
        Validate.notBlank(sourcePath, "sourcePath must not be blank.");

        String content = !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;

        Map<String, String> header = new LinkedHashMap<>();
        int bodyStart = readHeader(content, sourcePath, header);
        String body = content.substring(bodyStart);
        if (StringUtils.isBlank(body)) {
            throw new ModelParseException(sourcePath, "model body is empty");
        }

        String name = resolveName(header, sourcePath);
        Materialization materialization = resolveMaterialization(header, sourcePath);
        List<String> partitionBy = splitList(header.get(KEY_PARTITION_BY));
        Set<String> dependsOn = new LinkedHashSet<>(splitList(header.get(KEY_DEPENDS_ON)));

        if (materialization == Materialization.VIEW && !partitionBy.isEmpty()) {
            log.warn("[{}] partition_by {} is ignored for a view ({})", name, partitionBy,
                    sourcePath);
            partitionBy = List.of();
        }

        Model model =
                new Model(name, materialization, partitionBy, dependsOn, body, sourcePath);
        log.debug("Parsed model: {}", model);
        return model;
    }

    /**
     * Reads the header block into {@code header} and returns the offset where the body begins.
     *
     * @param content file content without BOM
     * @param sourcePath file path for error messages
     * @param header output map of recognized keys (lower-case) to trimmed values
     * @return body start offset
     */
    private int readHeader(String content, String sourcePath, Map<String, String> header) {
        int pos = 0;
        while (pos < content.length()) {
            int eol = content.indexOf('\n', pos);
            int lineEnd = eol < 0 ? content.length() : eol;
            int next = eol < 0 ? content.length() : eol + 1;
            String line = content.substring(pos, lineEnd).strip();

            if (line.isEmpty()) {
                pos = next;
                continue;
            }
            Matcher m = HEADER_LINE.matcher(line);
            if (!m.matches()) {
                break;
            }

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String value = m.group(2).trim();
            if (!RECOGNIZED_KEYS.contains(key)) {
                log.debug("Ignoring unrecognized header key '{}' in {}", key, sourcePath);
            } else if (header.putIfAbsent(key, value) != null) {
                throw new ModelParseException(sourcePath,
                        "header key '" + key + "' is declared more than once");
            }
            pos = next;
        }
        return pos;
    }

    private String resolveName(Map<String, String> header, String sourcePath) {
        if (!header.containsKey(KEY_NAME)) {
            return FilenameUtils.getBaseName(sourcePath);
        }
        String name = header.get(KEY_NAME);
        if (name.isEmpty()) {
            throw new ModelParseException(sourcePath, "header 'name' must not be blank");
        }
        return name;
    }

    private Materialization resolveMaterialization(Map<String, String> header,
            String sourcePath) {
        String value = header.get(KEY_MATERIALIZED);
        if (value == null) {
            return Materialization.VIEW;
        }
        return Materialization.fromHeaderValue(value)
                .orElseThrow(() -> new ModelParseException(sourcePath,
                        "unknown materialization '" + value
                                + "' (expected one of view, table, incremental)"));
    }

    private static List<String> splitList(String value) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }
}
