package bigo.cli;

import bigo.Pseudocode;
import bigo.analysis.ConditionalAnalyzer;
import bigo.analysis.LoopAnalyzer;
import bigo.analysis.RecursionAnalyzer;
import bigo.ast.AstSerializer;
import bigo.ast.Program;
import bigo.ast.decl.Subroutine;
import bigo.parser.SyntaxException;
import bigo.resolve.MasterTheorem;
import bigo.resolve.RecursionTree;
import bigo.resolve.Resolution;
import bigo.resolve.SubstitutionSolver;
import bigo.resolve.SummationSolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final String USAGE = """
            Usage: bigo ast <file>
                   bigo analyze <file>
                   bigo solve <master|substitution|tree|expand|summation> <text>""";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 2) {
            System.err.println(USAGE);
            return 2;
        }

        // output holds symbols like Σ and ², always UTF-8
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        try {
            switch (args[0]) {
                case "ast" -> out.println(AstSerializer.toJson(load(Path.of(args[1]))));
                case "analyze" -> out.println(MAPPER.writeValueAsString(analyze(load(Path.of(args[1])))));
                case "solve" -> {
                    if (args.length < 3) {
                        System.err.println(USAGE);
                        return 2;
                    }
                    String text = String.join(" ", Arrays.copyOfRange(args, 2, args.length));
                    Resolution result = solve(args[1], text);
                    if (result == null) {
                        System.err.println("Unknown method: " + args[1]);
                        System.err.println(USAGE);
                        return 2;
                    }
                    out.println(MAPPER.writeValueAsString(result));
                    return result.success() ? 0 : 1;
                }
                default -> {
                    System.err.println("Unknown command: " + args[0]);
                    System.err.println(USAGE);
                    return 2;
                }
            }
            return 0;
        } catch (SyntaxException e) {
            logger.error("Syntax error in {}: {}", args[1], e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Cannot read {}", args[1], e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static Program load(Path input) throws IOException {
        String source = Files.readString(input);
        logger.info("[1/2] Reading: {}", input);

        Program program = Pseudocode.parse(source);
        logger.info("[2/2] Parsed: {} classes, {} subroutines",
                program.classes().size(), program.algorithm().subroutines().size());
        return program;
    }

    private static List<Map<String, Object>> analyze(Program program) {
        List<Map<String, Object>> reports = new ArrayList<>();
        for (Subroutine sub : program.algorithm().subroutines()) {
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("subroutine", sub.name());
            report.put("recursiveCalls", RecursionAnalyzer.findRecursiveCalls(sub));
            report.put("baseCase", RecursionAnalyzer.detectBaseCase(sub));
            if (!sub.parameters().isEmpty()) {
                String param = sub.parameters().get(0).name();
                report.put("recursionParameter", RecursionAnalyzer.analyzeRecursionParameter(sub, param));
            }
            report.put("loops", LoopAnalyzer.analyzeLoops(sub));
            report.put("conditionals", ConditionalAnalyzer.detectConditionals(sub));
            reports.add(report);
        }
        logger.info("Analyzed {} subroutines", reports.size());
        return reports;
    }

    private static Resolution solve(String method, String text) {
        return switch (method) {
            case "master" -> MasterTheorem.apply(text);
            case "substitution" -> SubstitutionSolver.solve(text);
            case "tree" -> RecursionTree.analyze(text);
            case "expand" -> SubstitutionSolver.expandDivideAndConquer(text);
            case "summation" -> SummationSolver.simplify(text);
            default -> null;
        };
    }
}
