package main;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import util.print.CFGWriter;
import util.print.PrettyPrinter;
import analysis.guards.GuardAnalysisSession;
import analysis.guards.GuardResults;
import analysis.guards.cfg.ControlFlowGraph;
import analysis.guards.serialization.CFGReader;

import com.beust.jcommander.ParameterException;

/**
 * Run the guard analysis on every function of a JSON file, see usage
 */
public class GuardAnalysisMain {

    /**
     * Name of the results file written to the output directory
     */
    public static final String RESULTS_FILE = "guards.json";

    /**
     * Run the analysis
     *
     * @param args
     *            options and parameters see useage (pass in "-h") for details
     * @throws IOException
     *             file reading or writing issues
     * @throws JSONException
     *             issues writing JSON
     */
    public static void main(String[] args) throws IOException, JSONException {
        GuardAnalysisOptions options;
        try {
            options = GuardAnalysisOptions.getOptions(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(GuardAnalysisOptions.getUseage());
            System.exit(1);
            return;
        }
        if (options.shouldPrintUseage()) {
            System.err.println(GuardAnalysisOptions.getUseage());
            return;
        }

        int outputLevel = options.getOutputLevel();
        int fileLevel = options.getFileLevel();
        String outputDir = options.getOutputDir();

        long start = System.currentTimeMillis();
        List<ControlFlowGraph> cfgs = new CFGReader(outputLevel).read(Paths.get(options.getInputFile()));
        if (outputLevel >= 3) {
            for (ControlFlowGraph cfg : cfgs) {
                System.err.println(PrettyPrinter.cfgString(cfg, "\t", "\n"));
            }
        }

        if (fileLevel >= 1) {
            String dir = outputDir == null ? "." : outputDir;
            new File(dir).mkdirs();
            for (ControlFlowGraph cfg : cfgs) {
                CFGWriter.writeToFile(cfg, dir);
            }
        }

        List<GuardResults> results = analyze(cfgs, options.getNumThreads(), outputLevel);
        JSONObject json = toJSON(results);
        if (outputDir == null) {
            Writer out = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            json.write(out, 2, 0);
            out.write("\n");
            out.flush();
        }
        else {
            new File(outputDir).mkdirs();
            String fullFilename = outputDir + "/" + RESULTS_FILE;
            try (Writer out = new BufferedWriter(new FileWriter(fullFilename, StandardCharsets.UTF_8))) {
                json.write(out, 2, 0);
            }
            System.err.println("JSON written to: " + fullFilename);
        }
        if (outputLevel >= 1) {
            System.err.println("Analyzed " + cfgs.size() + " functions in " + (System.currentTimeMillis() - start)
                    + "ms");
        }
    }

    /**
     * Analyze each control flow graph in its own session
     *
     * @param cfgs
     *            graphs to analyze
     * @param numThreads
     *            number of threads to analyze with
     * @param outputLevel
     *            level of output, higher means more is printed
     * @return results for each graph, in the same order as <code>cfgs</code>
     */
    public static List<GuardResults> analyze(List<ControlFlowGraph> cfgs, int numThreads, final int outputLevel) {
        ExecutorService exec = Executors.newFixedThreadPool(numThreads);
        try {
            List<Future<GuardResults>> futures = new ArrayList<>(cfgs.size());
            for (final ControlFlowGraph cfg : cfgs) {
                futures.add(exec.submit(new Callable<GuardResults>() {
                    @Override
                    public GuardResults call() {
                        GuardResults r = new GuardResults(new GuardAnalysisSession(cfg, outputLevel));
                        if (outputLevel >= 1) {
                            System.err.println(r);
                        }
                        return r;
                    }
                }));
            }
            List<GuardResults> results = new ArrayList<>(cfgs.size());
            for (Future<GuardResults> f : futures) {
                results.add(f.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while analyzing", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RuntimeException(cause);
        } finally {
            exec.shutdownNow();
        }
    }

    /**
     * Collect the results for all functions into one JSON object
     *
     * @param results
     *            results for each function
     * @return JSON object with a "functions" array
     */
    public static JSONObject toJSON(List<GuardResults> results) {
        JSONArray functions = new JSONArray();
        for (GuardResults r : results) {
            functions.put(r.toJSON());
        }
        JSONObject json = new JSONObject();
        json.put("functions", functions);
        return json;
    }
}
