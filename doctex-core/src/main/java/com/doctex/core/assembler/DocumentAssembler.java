package com.doctex.core.assembler;

import com.doctex.core.config.RenderConfig;
import com.doctex.core.model.RenderWarning;
import com.doctex.core.model.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assembles the final document from the rendered body, the zone buffers and a template.
 *
 * <h2>Templates</h2>
 * <p>Templates are configured strings with {@code {{name}}} placeholders. Zone
 * placeholders ({@code {{frontmatter}}}, {@code {{body}}}, {@code {{appendix}}},
 * {@code {{index}}}, {@code {{backmatter}}}, {@code {{copying}}}) receive their zone
 * buffer joined by blank lines; field placeholders ({@code {{title}}},
 * {@code {{preamble}}}, ...) receive the field value. Placeholders the assembler does not
 * know are left untouched.
 *
 * <h2>Minimal layout</h2>
 * <p>Without a template name, or when the named template is not configured, the zones are
 * concatenated in the order frontmatter, body, appendix, index, backmatter, copying,
 * separated by blank lines, empty zones omitted. A configured but missing name also
 * records a {@link RenderWarning.Type#MISSING_TEMPLATE} warning.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * DocumentAssembler assembler = new DocumentAssembler(config);
 * String preamble = assembler.buildPreamble(ctx.usedEnvironments(), List.of("paper"));
 * String text = assembler.assembleDocument(body, ctx.zoneBuffers(), "article",
 *     Map.of("preamble", preamble, "title", "Report"));
 * }</pre>
 *
 * <p>One assembler serves one render; its warnings belong to that render.
 */
public class DocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(DocumentAssembler.class);

    /** Zone order of the minimal layout. */
    public static final List<Zone> MINIMAL_ORDER = List.of(
        Zone.FRONTMATTER, Zone.BODY, Zone.APPENDIX, Zone.INDEX, Zone.BACKMATTER, Zone.COPYING);

    static final String SEPARATOR = "\n\n";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Za-z][A-Za-z0-9_-]*)\\}\\}");

    private final RenderConfig config;
    private final List<RenderWarning> warnings = new ArrayList<>();

    public DocumentAssembler(RenderConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Assembles a document without extra fields.
     *
     * @param body rendered body text
     * @param zones zone buffers in traversal order
     * @param templateName template name, null for the minimal layout
     * @return assembled document
     */
    public String assembleDocument(String body, Map<Zone, List<String>> zones, String templateName) {
        return assembleDocument(body, zones, templateName, Map.of());
    }

    /**
     * Assembles a document.
     *
     * @param body rendered body text
     * @param zones zone buffers in traversal order
     * @param templateName template name, null for the minimal layout
     * @param fields values for non-zone placeholders such as {@code title} or {@code preamble}
     * @return assembled document
     */
    public String assembleDocument(String body, Map<Zone, List<String>> zones, String templateName,
                                   Map<String, String> fields) {
        Objects.requireNonNull(zones, "zones must not be null");
        Map<String, String> zoneTexts = zoneTexts(body == null ? "" : body, zones);

        String template = templateName == null ? null : config.templates().get(templateName);
        if (template == null) {
            if (templateName != null) {
                String message = "Template '" + templateName + "' is not configured, using the minimal layout";
                log.warn("{}", message);
                warnings.add(new RenderWarning(RenderWarning.Type.MISSING_TEMPLATE, message));
            }
            return minimal(zoneTexts);
        }

        Map<String, String> values = new LinkedHashMap<>(fields == null ? Map.of() : fields);
        values.putAll(zoneTexts);
        log.debug("Assembling with template '{}' and {} placeholder values", templateName, values.size());
        return substitute(template, values);
    }

    /**
     * Builds the preamble: the definitions of used environments in first-use order,
     * followed by the named snippets. Unknown snippet names are skipped with a warning.
     *
     * @param environments used environment definitions by name
     * @param snippetNames snippet names in document order
     * @return preamble text, possibly empty
     */
    public String buildPreamble(Map<String, String> environments, List<String> snippetNames) {
        List<String> parts = new ArrayList<>(environments.values());
        for (String name : snippetNames) {
            String snippet = config.snippets().get(name);
            if (snippet == null) {
                String message = "Unknown snippet: " + name;
                log.warn("{}", message);
                warnings.add(new RenderWarning(RenderWarning.Type.UNKNOWN_SNIPPET, message));
            } else {
                parts.add(snippet.strip());
            }
        }
        return String.join("\n", parts);
    }

    public List<RenderWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Replaces every known {@code {{name}}} placeholder. Unknown placeholders stay as they
     * are.
     *
     * @param template template text
     * @param values placeholder values
     * @return substituted text
     */
    static String substitute(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value == null ? matcher.group() : value;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static Map<String, String> zoneTexts(String body, Map<Zone, List<String>> zones) {
        Map<String, String> texts = new LinkedHashMap<>();
        for (Zone zone : Zone.values()) {
            List<String> parts = new ArrayList<>();
            if (zone == Zone.BODY && !body.isBlank()) {
                parts.add(body);
            }
            parts.addAll(zones.getOrDefault(zone, List.of()));
            texts.put(zone.placeholder(), join(parts));
        }
        return texts;
    }

    private static String minimal(Map<String, String> zoneTexts) {
        List<String> parts = new ArrayList<>();
        for (Zone zone : MINIMAL_ORDER) {
            String text = zoneTexts.get(zone.placeholder());
            if (!text.isEmpty()) {
                parts.add(text);
            }
        }
        return parts.isEmpty() ? "" : String.join(SEPARATOR, parts) + "\n";
    }

    private static String join(List<String> parts) {
        List<String> trimmed = new ArrayList<>(parts.size());
        for (String part : parts) {
            String text = part.strip();
            if (!text.isEmpty()) {
                trimmed.add(text);
            }
        }
        return String.join(SEPARATOR, trimmed);
    }
}
