package com.mathparse.expr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mathparse.util.LoggingUtil;
import com.mathparse.util.ParserSettings;

import java.io.File;
import java.util.*;

/**
 * Entry point for embedding applications: text in, tree or double out.
 * <p>
 * Instances hold no per-call state. The angle unit is passed with each evaluation, so one parser
 * can serve concurrent callers using different units.
 */
public class MathParser {

    private final FunctionRegistry registry;
    private final Tokenizer tokenizer = new Tokenizer();
    private final ImplicitMultiplicationExpander expander = new ImplicitMultiplicationExpander();
    private final ShuntingYardConverter converter = new ShuntingYardConverter();
    private final TreeBuilder treeBuilder;
    private final Evaluator evaluator;
    private BatchFailureMode failureMode = BatchFailureMode.WARNING;

    public MathParser() {
        this(FunctionRegistry.standard());
    }

    public MathParser(FunctionRegistry registry) {
        this.registry = registry;
        this.treeBuilder = new TreeBuilder(registry);
        this.evaluator = new Evaluator(registry);
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    public BatchFailureMode getFailureMode() {
        return failureMode;
    }

    public void setFailureMode(BatchFailureMode mode) {
        this.failureMode = mode;
    }

    public List<Token> scan(String input) {
        return tokenizer.scan(input);
    }

    /**
     * Parse an expression into a tree. Returns empty for input without any tokens.
     */
    public Optional<ExpressionNode> parse(String input) {
        List<Token> tokens = expander.expand(tokenizer.scan(input));
        List<Token> postfix = converter.toPostfix(tokens);
        return treeBuilder.build(postfix);
    }

    public double evaluate(ExpressionNode node, EvaluationConfig config) {
        return evaluator.evaluate(node, config);
    }

    public double evaluate(String input, EvaluationConfig config) {
        ExpressionNode root = parse(input)
                .orElseThrow(() -> new ExpressionSyntaxException("Empty expression"));
        double result = evaluate(root, config);
        LoggingUtil.debug("Evaluated '" + input + "' => " + result);
        return result;
    }

    public double evaluate(String input) {
        return evaluate(input, EvaluationConfig.defaults());
    }

    /**
     * Evaluate named expressions in insertion order. Under {@link BatchFailureMode#WARNING} a
     * failing entry is logged and mapped to null.
     */
    public Map<String, Double> evaluateAll(Map<String, String> expressions, EvaluationConfig config) {
        Map<String, Double> results = new LinkedHashMap<>();

        for (Map.Entry<String, String> entry : expressions.entrySet()) {
            String key = entry.getKey();
            try {
                results.put(key, evaluate(entry.getValue(), config));
            } catch (ExpressionException e) {
                if (failureMode == BatchFailureMode.EXCEPTION) throw e;
                LoggingUtil.warn("Failed to evaluate [" + key + "]: " + e.getMessage());
                results.put(key, null);
            }
        }

        return results;
    }

    /**
     * Named expressions of a batch document, read from its {@code expressions} object in
     * document order.
     */
    public static Map<String, String> loadExpressions(JsonNode batch) {
        Map<String, String> expressions = new LinkedHashMap<>();
        JsonNode expressionsNode = batch.path("expressions");
        Iterator<String> names = expressionsNode.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            expressions.put(name, expressionsNode.get(name).asText());
        }
        return expressions;
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: java com.mathparse.expr.MathParser <expressions.json> [settings.json]");
            System.exit(1);
        }

        ParserSettings settings = args.length == 2
                ? new ParserSettings(args[1])
                : ParserSettings.fromClasspath();
        LoggingUtil.initialize(settings);

        File file = new File(args[0]);
        if (!file.exists()) {
            LoggingUtil.error("File not found: " + args[0]);
            System.exit(2);
        }

        JsonNode batch = new ObjectMapper().readTree(file);
        settings.apply(batch);
        Map<String, String> expressions = loadExpressions(batch);
        LoggingUtil.info("Loaded " + expressions.size() + " expressions from " + file.getPath());

        MathParser parser = new MathParser();
        parser.setFailureMode(settings.getFailureMode());
        Map<String, Double> results = parser.evaluateAll(expressions, settings.toEvaluationConfig());

        results.forEach((k, v) -> System.out.println(k + " = " + (v != null ? v : "error")));
    }
}
