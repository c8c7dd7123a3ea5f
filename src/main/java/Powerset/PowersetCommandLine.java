package Powerset;

import Powerset.Interop.AutomataLibViews;
import Powerset.Model.Automaton;
import Powerset.Model.AutomatonDef;
import Powerset.Model.InputLimit;
import Powerset.Model.ValidationException;
import Powerset.Serialization.AutomatonJson;
import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

public class PowersetCommandLine {
  private static final Logger LOG = LoggerFactory.getLogger(PowersetCommandLine.class);

  public static void main(String[] args) {
    String outputFile = null;
    boolean verify = false;
    InputLimit limit = InputLimit.unbounded();
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        enableDebug();
      } else if ("--verify".equalsIgnoreCase(arg)) {
        verify = true;
      } else if ("--output".equalsIgnoreCase(arg)) {
        outputFile = requireValue(args, i++, arg);
      } else if ("--maxStates".equalsIgnoreCase(arg)) {
        String value = requireValue(args, i++, arg);
        try {
          limit = new InputLimit(Integer.parseInt(value));
        } catch (IllegalArgumentException e) {
          System.err.println("Invalid value for --maxStates: " + value);
          printUsageAndExit(); // exits
        }
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    boolean validInvocation = (positional.size() == 2) && isRequest(positional.get(0));
    if (!validInvocation) {
      printUsageAndExit();
    }

    String request = positional.get(0);
    String filePath = positional.get(1);

    Response response;
    try {
      AutomatonDef def = AutomatonJson.readDef(new File(filePath));
      response = respond(new TransformationPipeline(limit), request, def, verify);
    } catch (IOException e) {
      LOG.error("Could not read automaton from {}", filePath, e);
      response = Response.error("Could not read automaton: " + e.getMessage());
    }

    if (outputFile != null) {
      writeFile(outputFile, response.json());
    } else {
      System.out.println(response.json());
    }
    if (!response.ok()) {
      System.exit(1);
    }
  }

  private static String requireValue(String[] args, int i, String flag) {
    // Require a value that isn't another flag
    if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
      System.err.println("Missing value for " + flag);
      printUsageAndExit(); // exits
    }
    return args[i + 1];
  }

  private static boolean isRequest(String request) {
    return "convert".equalsIgnoreCase(request) || "minimize".equalsIgnoreCase(request);
  }

  private static void printUsageAndExit() {
    System.out.println(
        "Powerset [--debug] [--verify] [--maxStates <n>] [--output <JSON output file>] <request> <JSON input file>");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println("[--verify] : Cross-check the result against AutomataLib's determinizer and minimizer");
    System.out.println("[--maxStates <n>] : Reject automata declaring more than n states");
    System.out.println("[--output <JSON output file>] : Write the response to the specified file instead of stdout");
    System.out.println();
    System.out.println("<request> : one of the choices below:");
    System.out.println("  convert: NFA to DFA (subset construction).");
    System.out.println("  minimize: NFA to minimal DFA (subset construction, then partition refinement).");
    System.out.println();
    System.out.println("<JSON input file> : automaton definition with states, alphabet, transitions, start, accept.");
    System.out.println("  Transitions are [from, symbol, to] triples; a null symbol is an epsilon transition.");
    System.exit(0);
  }

  /**
   * Run one request and encode the response.
   * @param pipeline - pipeline to run the request on
   * @param request - "convert" or "minimize"
   * @param def - automaton definition
   * @param verify - whether to cross-check the DFA with AutomataLib
   * @return - JSON response, with the error form on validation or verification failure
   */
  static Response respond(TransformationPipeline pipeline, String request, AutomatonDef def, boolean verify)
      throws IOException {
    LOG.info("Invoking request: {}", request);
    long before = System.currentTimeMillis();
    TransformationResult result;
    try {
      result = pipeline.handle(request, def);
    } catch (ValidationException e) {
      LOG.info("Rejected: {}", e.getMessage());
      return Response.error(e.getMessage());
    }
    long after = System.currentTimeMillis();
    LOG.info("Validated NFA size: {} ({} dropped)", result.nfa().size(), result.dropped().size());
    LOG.info("Alphabet size: {}", result.nfa().getAlphabet().size());
    LOG.info("{} DFA size: {}", request, result.dfa().size());
    LOG.info("{} duration: {}s", request, (after - before) / 1000f);

    if (verify) {
      String mismatch = verify(request, result);
      if (mismatch != null) {
        LOG.error(mismatch);
        return Response.error(mismatch);
      }
      LOG.info("Verified against AutomataLib");
    }
    return new Response(AutomatonJson.writeResult(result), true);
  }

  /**
   * @return - description of the mismatch, or null if the result agrees with AutomataLib
   */
  private static String verify(String request, TransformationResult result) {
    if (!AutomataLibViews.isEquivalent(result.nfa(), result.dfa())) {
      return "Verification failed: DFA language differs from NFA language";
    }
    if ("minimize".equalsIgnoreCase(request)) {
      Automaton dfa = result.dfa();
      // missing transitions are kept apart from dead states, so the size bound only holds without them
      if (MooreMinimizer.liveStates(dfa).cardinality() < dfa.size()) {
        LOG.info("Minimal DFA has dead states; skipping size check");
        return null;
      }
      int reference = AutomataLibViews.referenceMinimalSize(result.nfa());
      int size = dfa.size();
      // a partial minimal DFA saves at most the sink state
      if (size > reference || size < reference - 1) {
        return "Verification failed: minimal DFA has " + size + " states, AutomataLib's total minimal DFA has "
            + reference;
      }
    }
    return null;
  }

  private static void enableDebug() {
    org.slf4j.Logger root = LoggerFactory.getLogger("Powerset");
    if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
      logbackLogger.setLevel(Level.DEBUG);
    }
  }

  private static void writeFile(String filename, String json) {
    LOG.info("Writing to file: {}", filename);
    try {
      Files.writeString(new File(filename).toPath(), json, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  record Response(String json, boolean ok) {
    static Response error(String cause) {
      return new Response(AutomatonJson.writeError(cause), false);
    }
  }
}
