package com.doctex.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration injected into a render pass.
 *
 * <p>The engine treats this object as opaque input; it never loads it from disk itself.
 * {@link ConfigLoader} builds one from {@code doctex.yaml} for the command line.
 *
 * <p>Map-valued options are merged over the built-in ConTeXt defaults, so a YAML file
 * only needs to list what it changes. Scalar options left out fall back to the defaults,
 * so a file without {@code defaultTemplate} renders with {@code article} like
 * {@link #defaults()}. An empty {@code defaultTemplate} selects the minimal layout.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * defaultTemplate: article
 * language: en
 * smartQuotes: true
 * snippets:
 *   paper: "\\setuppapersize[A4]"
 * languages:
 *   emacs-lisp: lisp
 * table:
 *   footerStyle: OrgTableFooter
 * }</pre>
 *
 * @param templates template strings keyed by name
 * @param defaultTemplate template used when the document does not name one, {@code article}
 *                        when absent; null after an empty value, which makes the assembler
 *                        use its built-in minimal layout
 * @param snippets preamble snippets keyed by name
 * @param environments environment and style definitions keyed by name
 * @param table table styling options
 * @param quotes smart-quote delimiters keyed by language
 * @param languages source language name translations (document name to highlighter name)
 * @param headingCommands section commands for numbered headings, by level
 * @param unnumberedHeadingCommands section commands for unnumbered headings, by level
 * @param markup inline markup formats keyed by markup name, {@code %s} marks the content
 * @param smartQuotes whether plain text gets smart quotes
 * @param language default document language
 * @param srcEnvironmentPrefix prefix of generated source block environment names
 * @param backends raw block backend names passed through verbatim
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RenderConfig(
    @JsonProperty("templates") Map<String, String> templates,
    @JsonProperty("defaultTemplate") String defaultTemplate,
    @JsonProperty("snippets") Map<String, String> snippets,
    @JsonProperty("environments") Map<String, String> environments,
    @JsonProperty("table") TableStyleConfig table,
    @JsonProperty("quotes") Map<String, QuoteStyle> quotes,
    @JsonProperty("languages") Map<String, String> languages,
    @JsonProperty("headingCommands") List<String> headingCommands,
    @JsonProperty("unnumberedHeadingCommands") List<String> unnumberedHeadingCommands,
    @JsonProperty("markup") Map<String, String> markup,
    @JsonProperty("smartQuotes") Boolean smartQuotes,
    @JsonProperty("language") String language,
    @JsonProperty("srcEnvironmentPrefix") String srcEnvironmentPrefix,
    @JsonProperty("backends") List<String> backends
) {
    public static final String ARTICLE_TEMPLATE = "article";

    private static final String ARTICLE = """
        %% Generated by DocTeX
        {{preamble}}
        \\mainlanguage[{{language}}]
        \\setupinteraction[state=start,title={{{title}}},author={{{author}}},keyword={{{keywords}}}]
        \\setupcombinedlist[content][list={section,subsection,subsubsection}]

        \\starttext
        \\startstandardmakeup
        \\startalignment[middle]
        {\\tfd {{title}}}
        \\blank[big]
        {\\tfb {{subtitle}}}
        \\blank[big]
        {{author}}
        \\blank
        {{date}}
        \\stopalignment
        \\stopstandardmakeup

        \\startfrontmatter
        {{frontmatter}}
        \\stopfrontmatter

        \\startbodymatter
        {{body}}
        \\stopbodymatter

        \\startappendices
        {{appendix}}
        \\stopappendices

        {{index}}

        \\startbackmatter
        {{backmatter}}
        \\stopbackmatter

        {{copying}}
        \\stoptext
        """.replace("%%", "%");

    private static final String PLAIN = """
        {{preamble}}
        \\mainlanguage[{{language}}]
        \\starttext
        {{frontmatter}}

        {{body}}

        {{appendix}}

        {{backmatter}}
        \\stoptext
        """;

    private static final Map<String, String> DEFAULT_TEMPLATES = Map.of(
        ARTICLE_TEMPLATE, ARTICLE,
        "plain", PLAIN
    );

    private static final Map<String, String> DEFAULT_MARKUP = Map.of(
        "bold", "\\bold{%s}",
        "italic", "\\italic{%s}",
        "underline", "\\underbar{%s}",
        "strike-through", "\\overstrike{%s}",
        "subscript", "\\low{%s}",
        "superscript", "\\high{%s}",
        "line-break", "\\crlf",
        "horizontal-rule", "\\textrule"
    );

    private static final Map<String, String> DEFAULT_LANGUAGES = Map.of(
        "emacs-lisp", "lisp",
        "elisp", "lisp",
        "sh", "bash",
        "shell", "bash",
        "js", "javascript",
        "c++", "cpp"
    );

    private static final List<String> DEFAULT_HEADINGS =
        List.of("section", "subsection", "subsubsection", "subsubsubsection");

    private static final List<String> DEFAULT_UNNUMBERED_HEADINGS =
        List.of("subject", "subsubject", "subsubsubject", "subsubsubsubject");

    /**
     * Compact constructor merging every option over the built-in defaults.
     */
    public RenderConfig {
        templates = merge(DEFAULT_TEMPLATES, templates);
        if (defaultTemplate == null) {
            defaultTemplate = ARTICLE_TEMPLATE;
        } else if (defaultTemplate.isBlank()) {
            defaultTemplate = null;
        }
        snippets = merge(Map.of(), snippets);
        environments = merge(Map.of(), environments);
        table = table == null ? TableStyleConfig.defaults() : table;
        quotes = merge(Map.of("en", QuoteStyle.contextDefault()), quotes);
        languages = merge(DEFAULT_LANGUAGES, languages);
        headingCommands = headingCommands == null || headingCommands.isEmpty()
            ? DEFAULT_HEADINGS : List.copyOf(headingCommands);
        unnumberedHeadingCommands = unnumberedHeadingCommands == null || unnumberedHeadingCommands.isEmpty()
            ? DEFAULT_UNNUMBERED_HEADINGS : List.copyOf(unnumberedHeadingCommands);
        markup = merge(DEFAULT_MARKUP, markup);
        smartQuotes = smartQuotes == null ? Boolean.TRUE : smartQuotes;
        language = language == null || language.isBlank() ? "en" : language;
        srcEnvironmentPrefix = srcEnvironmentPrefix == null || srcEnvironmentPrefix.isBlank()
            ? "OrgSrc" : srcEnvironmentPrefix;
        backends = backends == null || backends.isEmpty() ? List.of("context") : List.copyOf(backends);
    }

    /**
     * Creates the default configuration: ConTeXt markup, the {@code article} template,
     * smart quotes on, English.
     *
     * @return default configuration
     */
    public static RenderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the quote style for a language, falling back to the configured default
     * language and then to the ConTeXt default.
     *
     * @param lang language code, may be null
     * @return quote style
     */
    public QuoteStyle quoteStyleFor(String lang) {
        if (lang != null && quotes.containsKey(lang)) {
            return quotes.get(lang);
        }
        return quotes.getOrDefault(language, QuoteStyle.contextDefault());
    }

    /**
     * Returns the markup format for a markup name.
     *
     * @param key markup name, e.g. {@code "bold"}
     * @return format string containing {@code %s}, or null
     */
    public String markupFor(String key) {
        return markup.get(key);
    }

    public boolean isRawBackend(String backend) {
        return backend != null && backends.contains(backend.trim().toLowerCase(Locale.ROOT));
    }

    private static <V> Map<String, V> merge(Map<String, V> defaults, Map<String, V> overrides) {
        Map<String, V> merged = new LinkedHashMap<>(defaults);
        if (overrides != null) {
            overrides.forEach((key, value) -> {
                if (key != null && value != null) {
                    merged.put(key, value);
                }
            });
        }
        return Collections.unmodifiableMap(merged);
    }

    /**
     * Builder used by tests and by callers assembling a configuration in code.
     */
    public static final class Builder {
        private final Map<String, String> templates = new LinkedHashMap<>();
        private String defaultTemplate = ARTICLE_TEMPLATE;
        private final Map<String, String> snippets = new LinkedHashMap<>();
        private final Map<String, String> environments = new LinkedHashMap<>();
        private TableStyleConfig table;
        private final Map<String, QuoteStyle> quotes = new LinkedHashMap<>();
        private final Map<String, String> languages = new LinkedHashMap<>();
        private List<String> headingCommands;
        private List<String> unnumberedHeadingCommands;
        private final Map<String, String> markup = new LinkedHashMap<>();
        private Boolean smartQuotes;
        private String language;
        private String srcEnvironmentPrefix;
        private List<String> backends;

        private Builder() {
        }

        public Builder template(String name, String body) {
            templates.put(name, body);
            return this;
        }

        public Builder defaultTemplate(String name) {
            this.defaultTemplate = name;
            return this;
        }

        public Builder snippet(String name, String body) {
            snippets.put(name, body);
            return this;
        }

        public Builder environment(String name, String definition) {
            environments.put(name, definition);
            return this;
        }

        public Builder table(TableStyleConfig value) {
            this.table = value;
            return this;
        }

        public Builder quotes(String lang, QuoteStyle style) {
            quotes.put(lang, style);
            return this;
        }

        public Builder languageTranslation(String from, String to) {
            languages.put(from, to);
            return this;
        }

        public Builder headingCommands(List<String> value) {
            this.headingCommands = value;
            return this;
        }

        public Builder unnumberedHeadingCommands(List<String> value) {
            this.unnumberedHeadingCommands = value;
            return this;
        }

        public Builder markup(String key, String format) {
            markup.put(key, format);
            return this;
        }

        public Builder smartQuotes(boolean value) {
            this.smartQuotes = value;
            return this;
        }

        public Builder language(String value) {
            this.language = value;
            return this;
        }

        public Builder srcEnvironmentPrefix(String value) {
            this.srcEnvironmentPrefix = value;
            return this;
        }

        public Builder backends(List<String> value) {
            this.backends = value;
            return this;
        }

        public RenderConfig build() {
            return new RenderConfig(templates, defaultTemplate, snippets, environments, table, quotes,
                languages, headingCommands, unnumberedHeadingCommands, markup, smartQuotes, language,
                srcEnvironmentPrefix, backends);
        }
    }
}
