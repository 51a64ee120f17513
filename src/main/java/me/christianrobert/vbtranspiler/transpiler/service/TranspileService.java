package me.christianrobert.vbtranspiler.transpiler.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.vbtranspiler.config.service.ConfigService;
import me.christianrobert.vbtranspiler.core.model.Language;
import me.christianrobert.vbtranspiler.transpiler.ai.AiConnectionResult;
import me.christianrobert.vbtranspiler.transpiler.ai.AiEndpoint;
import me.christianrobert.vbtranspiler.transpiler.ai.AiRewriteClient;
import me.christianrobert.vbtranspiler.transpiler.ai.AiRewriteResult;
import me.christianrobert.vbtranspiler.transpiler.context.SourceAnalysis;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileException;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileMethod;
import me.christianrobert.vbtranspiler.transpiler.context.TranspileResult;
import me.christianrobert.vbtranspiler.transpiler.parser.ParseResult;
import me.christianrobert.vbtranspiler.transpiler.parser.SourceParser;
import me.christianrobert.vbtranspiler.transpiler.parser.SyntaxNode;
import me.christianrobert.vbtranspiler.transpiler.rewrite.BlockTrackingRewriter;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RewriteOutcome;
import me.christianrobert.vbtranspiler.transpiler.rewrite.RuleTable;
import me.christianrobert.vbtranspiler.transpiler.rewrite.rules.RuleTableRegistry;
import me.christianrobert.vbtranspiler.transpiler.semantic.SemanticExtractor;
import me.christianrobert.vbtranspiler.transpiler.semantic.SemanticSummary;
import me.christianrobert.vbtranspiler.transpiler.util.AstTreeFormatter;
import me.christianrobert.vbtranspiler.transpiler.util.SyntaxTreeExporter;
import me.christianrobert.vbtranspiler.transpiler.validation.TranspileValidator;
import me.christianrobert.vbtranspiler.transpiler.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point for parsing, transpiling and validating VB6, VB.NET and C# source.
 *
 * <p>Transpile pipeline:
 * <pre>
 * source → parse → semantic summary → [AI rewrite] → rule-based rewrite per hop → validate → result
 *                                          ↓ failure
 *                                     fallback warning
 * </pre>
 *
 * <p>The AI path is tried first when requested, enabled and an endpoint is known. Any AI failure
 * falls through to the rule-based path with a warning. Conversions without a direct rule table
 * are chained through VB.NET; every hop is validated on its own.</p>
 *
 * <p>Transpile failures are returned as results, never thrown.</p>
 */
@ApplicationScoped
public class TranspileService {

    private static final Logger log = LoggerFactory.getLogger(TranspileService.class);

    @Inject
    SourceParser parser;

    @Inject
    SemanticExtractor semanticExtractor;

    @Inject
    RuleTableRegistry ruleTableRegistry;

    @Inject
    TranspileValidator validator;

    @Inject
    AiRewriteClient aiClient;

    @Inject
    ConfigService configService;

    // ========== Parse ==========

    /**
     * Parses source code and extracts its semantic summary.
     *
     * @param code Source code
     * @param languageTag Language tag such as "vb", "vbnet", "csharp"
     * @param showAst Whether to include a text rendering of the tree
     * @return Exported tree and summary, or the parse error
     */
    public SourceAnalysis parse(String code, String languageTag, boolean showAst) {
        Optional<Language> language = Language.fromTag(languageTag);
        if (language.isEmpty()) {
            return SourceAnalysis.failure(unsupportedLanguage(languageTag));
        }

        try {
            ParseResult parseResult = parser.parse(code, language.get());
            List<String> warnings = new ArrayList<>();
            SyntaxNode tree = null;

            if (!parseResult.isAvailable()) {
                warnings.add("No parser available for " + language.get().getDisplayName()
                        + ", semantic summary built from line scan");
            } else if (!parseResult.isSuccess()) {
                log.warn("Parse failed: {}", parseResult.getErrorMessage());
                return SourceAnalysis.failure("Parse errors: " + parseResult.getErrorMessage());
            } else {
                tree = parseResult.getTree();
            }

            SemanticSummary summary = semanticExtractor.extract(code, language.get(), tree);
            Map<String, Object> ast = tree != null ? createExporter().export(tree) : null;
            String astTree = showAst && tree != null ? AstTreeFormatter.format(tree) : null;

            log.debug("Parsed {} source: {}", language.get().getDisplayName(), summary);
            return SourceAnalysis.success(ast, summary, astTree, warnings);

        } catch (Exception e) {
            log.error("Unexpected error during parse", e);
            return SourceAnalysis.failure("Unexpected error: " + e.getMessage());
        }
    }

    // ========== Transpile ==========

    /**
     * Transpiles source code between two languages given as tags.
     *
     * @param code Source code
     * @param sourceTag Source language tag
     * @param targetTag Target language tag
     * @param useAi Whether to try the AI rewrite service first
     * @param endpoint AI endpoint of the request; null or unconfigured to use the configured one
     * @return The result; failures are results, never exceptions
     */
    public TranspileResult transpile(String code, String sourceTag, String targetTag, boolean useAi, AiEndpoint endpoint) {
        Optional<Language> source = Language.fromTag(sourceTag);
        if (source.isEmpty()) {
            return TranspileResult.failure(code, Collections.emptyList(), unsupportedLanguage(sourceTag));
        }
        Optional<Language> target = Language.fromTag(targetTag);
        if (target.isEmpty()) {
            return TranspileResult.failure(code, Collections.emptyList(), unsupportedLanguage(targetTag));
        }
        return transpile(code, source.get(), target.get(), useAi, endpoint);
    }

    /**
     * Transpiles source code between two languages.
     */
    public TranspileResult transpile(String code, Language source, Language target, boolean useAi, AiEndpoint endpoint) {
        log.debug("Transpiling {} -> {} (useAi={})", source.getDisplayName(), target.getDisplayName(), useAi);
        log.trace("Source code: {}", code);

        List<Language> path = conversionPath(source, target);
        if (path.isEmpty()) {
            String message = "Conversion from " + source.getDisplayName() + " to " + target.getDisplayName() + " not supported";
            log.warn(message);
            return TranspileResult.failure(code, Collections.emptyList(), message);
        }
        if (code == null || code.isBlank()) {
            return TranspileResult.failure(code, Collections.emptyList(), "Empty source code");
        }

        try {
            // Step 1: parse
            log.debug("Step 1: Parsing {} source", source.getDisplayName());
            ParseResult parseResult = parser.parse(code, source);
            if (parseResult.isAvailable() && !parseResult.isSuccess()) {
                String errorMsg = "Parse errors: " + parseResult.getErrorMessage();
                log.warn("Parse failed: {}", errorMsg);
                return TranspileResult.failure(code, Collections.emptyList(), errorMsg);
            }
            SyntaxNode tree = parseResult.getTree();

            // Step 2: semantic summary
            log.debug("Step 2: Extracting semantic summary");
            SemanticSummary summary = semanticExtractor.extract(code, source, tree);
            log.debug("Source declares {}", summary);

            // Step 3: AI rewrite, falls through on any failure
            List<String> warnings = new ArrayList<>();
            if (useAi) {
                log.debug("Step 3: Attempting AI-assisted conversion");
                TranspileResult aiResult = attemptAi(code, tree, source, target, endpoint, warnings);
                if (aiResult != null) {
                    log.info("Transpiled {} -> {} with the AI rewrite service", source.getDisplayName(), target.getDisplayName());
                    return aiResult;
                }
            }

            // Step 4: rule-based rewrite and validation
            log.debug("Step 4: Rule-based conversion via {}", path);
            return rewriteWithRules(code, path, warnings);

        } catch (TranspileException e) {
            log.error("Transpilation failed: {}", e.getDetailedMessage(), e);
            return TranspileResult.failure(code, e);

        } catch (Exception e) {
            log.error("Unexpected error during transpilation", e);
            return TranspileResult.failure(code, Collections.emptyList(), "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Languages visited by a conversion, source first, or empty when it is not supported.
     */
    List<Language> conversionPath(Language source, Language target) {
        if (source == target) {
            return Collections.emptyList();
        }
        if (ruleTableRegistry.supports(source, target)) {
            return List.of(source, target);
        }
        if (source != Language.VBNET && target != Language.VBNET
                && ruleTableRegistry.supports(source, Language.VBNET)
                && ruleTableRegistry.supports(Language.VBNET, target)) {
            return List.of(source, Language.VBNET, target);
        }
        return Collections.emptyList();
    }

    private TranspileResult attemptAi(String code, SyntaxNode tree, Language source, Language target,
                                      AiEndpoint requested, List<String> warnings) {
        if (!isAiEnabled()) {
            warnings.add("AI-assisted conversion is disabled, used rule-based conversion");
            return null;
        }
        AiEndpoint endpoint = requested != null && requested.isConfigured() ? requested : configuredEndpoint();
        if (!endpoint.isConfigured()) {
            warnings.add("AI server URL not configured, used rule-based conversion");
            return null;
        }

        Map<String, Object> ast = tree != null ? createExporter().export(tree) : Collections.emptyMap();
        AiRewriteResult result = aiClient.rewrite(endpoint, ast, code, source, target);
        if (result.isSuccess()) {
            return TranspileResult.success(result.getCode(), Collections.emptyList(), TranspileMethod.AI_ASSISTED);
        }

        log.warn("AI-assisted conversion failed, falling back to rules: {}", result.getErrorMessage());
        warnings.add("AI-assisted conversion failed (" + result.getErrorMessage() + "), fell back to rule-based conversion");
        return null;
    }

    private TranspileResult rewriteWithRules(String code, List<Language> path, List<String> warnings) {
        BlockTrackingRewriter rewriter = new BlockTrackingRewriter(
                configService.getConfigValueAsInt(ConfigService.REWRITE_INDENT_SIZE, BlockTrackingRewriter.DEFAULT_INDENT_SIZE));
        boolean chained = path.size() > 2;
        List<String> errors = new ArrayList<>();
        String text = code;
        RuleTable lastTable = null;

        for (int i = 0; i + 1 < path.size(); i++) {
            Language from = path.get(i);
            Language to = path.get(i + 1);
            RuleTable table = ruleTableRegistry.find(from, to)
                    .orElseThrow(() -> new TranspileException("No rule table for " + from.getDisplayName()
                            + " -> " + to.getDisplayName()));

            RewriteOutcome outcome = rewriter.rewrite(text, table);
            ValidationReport report = validator.validateRewrite(text, outcome, from, to);

            String prefix = chained ? "(" + from.getDisplayName() + " -> " + to.getDisplayName() + ") " : "";
            for (String warning : outcome.getWarnings()) {
                warnings.add(prefix + warning);
            }
            for (String warning : report.getWarningMessages()) {
                warnings.add(prefix + warning);
            }
            for (String error : report.getErrorMessages()) {
                errors.add(prefix + error);
            }
            text = outcome.getCode();
            lastTable = table;
        }

        Language source = path.get(0);
        Language target = path.get(path.size() - 1);
        if (chained) {
            warnings.add("Two-step conversion (" + source.getDisplayName() + " -> " + Language.VBNET.getDisplayName()
                    + " -> " + target.getDisplayName() + "). Extensive testing required.");
        } else if (lastTable != null && lastTable.getAdvisory() != null) {
            warnings.add(lastTable.getAdvisory());
        }

        if (!errors.isEmpty()) {
            log.warn("Rule-based conversion {} -> {} failed validation with {} errors",
                    source.getDisplayName(), target.getDisplayName(), errors.size());
            return TranspileResult.invalid(text, warnings, errors, TranspileMethod.RULE_BASED);
        }
        log.info("Transpiled {} -> {} with rules ({} warnings)", source.getDisplayName(), target.getDisplayName(), warnings.size());
        log.trace("Transpiled code: {}", text);
        return TranspileResult.success(text, warnings, TranspileMethod.RULE_BASED);
    }

    // ========== Validate ==========

    /**
     * Checks block balance of unconverted source.
     *
     * @throws TranspileException if the language tag is unknown
     */
    public ValidationReport validate(String code, String languageTag) {
        Language language = Language.fromTag(languageTag)
                .orElseThrow(() -> new TranspileException(unsupportedLanguage(languageTag)));
        return validator.validateSource(code, language);
    }

    // ========== AI connection ==========

    public AiConnectionResult testAiConnection(AiEndpoint endpoint) {
        return aiClient.testConnection(endpoint);
    }

    private boolean isAiEnabled() {
        Boolean enabled = configService.getConfigValueAsBoolean(ConfigService.AI_ENABLED);
        return enabled == null || enabled;
    }

    private AiEndpoint configuredEndpoint() {
        return new AiEndpoint(configService.getConfigValueAsString(ConfigService.AI_SERVER_URL),
                configService.getConfigValueAsString(ConfigService.AI_API_KEY));
    }

    private SyntaxTreeExporter createExporter() {
        return new SyntaxTreeExporter(
                configService.getConfigValueAsInt(ConfigService.AST_MAX_DEPTH, SyntaxTreeExporter.DEFAULT_MAX_DEPTH),
                configService.getConfigValueAsInt(ConfigService.AST_MAX_CHILDREN, SyntaxTreeExporter.DEFAULT_MAX_CHILDREN),
                configService.getConfigValueAsInt(ConfigService.AST_MAX_TEXT_LENGTH, SyntaxTreeExporter.DEFAULT_MAX_TEXT_LENGTH));
    }

    private static String unsupportedLanguage(String tag) {
        return "Unsupported language: " + tag;
    }
}
