package com.hcltech.vocab.hierarchy;

import com.hcltech.vocab.common.codec.Codec;
import com.hcltech.vocab.common.errorsor.ErrorsOr;
import com.hcltech.vocab.config.HierarchyConfig;
import com.hcltech.vocab.config.HierarchyConfigLoader;
import com.hcltech.vocab.hierarchy.codec.IndentedLineCodec;
import com.hcltech.vocab.hierarchy.codec.RelationMappingCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts concept hierarchies between indented text and relation mappings.
 * <p>
 * Stateless apart from its configuration: every call builds a fresh graph, so one instance can be shared.
 * Methods returning a graph or a list throw {@link StructuralException} on malformed input; the end-to-end
 * conversions return {@link ErrorsOr} instead and never throw.
 */
public final class HierarchyConverter {
    private static final Logger log = LoggerFactory.getLogger(HierarchyConverter.class);

    private final HierarchyConfig config;
    private final IndentSeparator separator;
    private final IndentParser parser;
    private final Codec<List<NodeLevel<String>>, String> textCodec;
    private final RelationMappingCodec relationCodec = new RelationMappingCodec();

    public HierarchyConverter(HierarchyConfig config, SeparatorWarningListener warnings) {
        this.config = HierarchyConfigLoader.validated(config);
        this.separator = IndentSeparator.from(this.config);
        this.parser = new IndentParser(separator, Objects.requireNonNull(warnings, "warnings"));
        this.textCodec = IndentedLineCodec.text(parser);
    }

    public HierarchyConverter(HierarchyConfig config) {
        this(config, SeparatorWarningListener.LOGGING);
    }

    public static HierarchyConverter defaults() {
        return new HierarchyConverter(HierarchyConfig.defaults());
    }

    public HierarchyConfig config() {
        return config;
    }

    /* ---------------- building ---------------- */

    public HierarchyGraph<String> fromText(String text) {
        List<NodeLevel<String>> rows = textCodec.decode(text).valueOrThrow();
        return logged("indented text", TextGraphBuilder.fromIndentedLines(rows));
    }

    public HierarchyGraph<String> fromLines(List<String> lines) {
        return logged("indented lines", TextGraphBuilder.fromLines(lines, parser));
    }

    public HierarchyGraph<String> fromRelations(Map<String, ? extends List<String>> relations) {
        return logged("relation mapping", RelationGraphBuilder.fromRelations(relations));
    }

    /* ---------------- rendering ---------------- */

    public HierarchyRendering<String> render(HierarchyGraph<String> graph) {
        return LevelAssigner.render(graph, config.baseLevel());
    }

    public List<NodeLevel<String>> nodeLevels(HierarchyGraph<String> graph) {
        return render(graph).levels();
    }

    public List<String> toIndentedText(HierarchyGraph<String> graph) {
        return toIndentedText(graph, separator);
    }

    /** Renders with a different separator than the one used for parsing. */
    public List<String> toIndentedText(HierarchyGraph<String> graph, IndentSeparator outputSeparator) {
        return IndentedTextSerializer.toLines(nodeLevels(graph), outputSeparator);
    }

    public Map<String, List<String>> toRelations(HierarchyGraph<String> graph) {
        return RelationSerializer.toNarrower(graph);
    }

    public Map<String, List<String>> toBroader(HierarchyGraph<String> graph) {
        return RelationSerializer.toBroader(graph);
    }

    /* ---------------- end-to-end, never throwing ---------------- */

    public ErrorsOr<Map<String, List<String>>> indentToRelations(String text) {
        return ErrorsOr.trying(() -> toRelations(fromText(text)));
    }

    public ErrorsOr<List<String>> relationsToIndent(Map<String, ? extends List<String>> relations) {
        if (relations == null) return ErrorsOr.error("Relation mapping must not be null");
        return RelationValidation.validate(relations)
                .flatMap(ok -> ErrorsOr.trying(() -> toIndentedText(fromRelations(relations))));
    }

    public ErrorsOr<HierarchyGraph<String>> relationsFromJson(String json) {
        return relationCodec.decode(json)
                .flatMap(relations -> RelationValidation.validate(relations).map(ok -> relations))
                .mapTry(this::fromRelations);
    }

    public ErrorsOr<String> relationsToJson(HierarchyGraph<String> graph) {
        return relationCodec.encode(toRelations(graph));
    }

    private HierarchyGraph<String> logged(String source, HierarchyGraph<String> graph) {
        log.info("Built hierarchy from {}: {} node(s), {} edge(s)", source, graph.nodes().size(), graph.edges().size());
        return graph;
    }
}
