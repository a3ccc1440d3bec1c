package main;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * Command line options for {@link GuardAnalysisMain}
 */
public final class GuardAnalysisOptions {

    /**
     * JSON file describing the control flow graphs to analyze
     */
    @Parameter(names = { "-in" }, required = true, description = "JSON file containing the control flow graphs to analyze.")
    private String inputFile;

    /**
     * Output folder, standard output if not set
     */
    @Parameter(names = { "-out" }, description = "Output directory, if not set the results are written to standard output.")
    private String outputDir;

    /**
     * Flag for printing useage information
     */
    @Parameter(names = { "-h", "-help", "-useage", "--help" }, help = true, description = "Print useage information")
    private boolean help = false;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, validateWith = GuardAnalysisOptions.NonNegativeValidator.class, description = "Level of output (higher means more console output)")
    private Integer outputLevel = 0;

    /**
     * Level of file output
     */
    @Parameter(names = "-fileLevel", validateWith = GuardAnalysisOptions.NonNegativeValidator.class, description = "Level of file output (higher means more files will be written, 1 or more writes a graphviz .dot file for each function)")
    private Integer fileLevel = 0;

    /**
     * Number of threads to analyze functions with
     */
    @Parameter(names = { "-threads", "-t" }, validateWith = GuardAnalysisOptions.PositiveValidator.class, description = "Number of threads to use, default is the number of available processors.")
    private Integer numThreads = Runtime.getRuntime().availableProcessors();

    /**
     * Validate that an integer option is not negative
     */
    public static class NonNegativeValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            if (parseInt(name, value) < 0) {
                throw new ParameterException("Parameter " + name + " must not be negative, found " + value);
            }
        }
    }

    /**
     * Validate that an integer option is positive
     */
    public static class PositiveValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            if (parseInt(name, value) <= 0) {
                throw new ParameterException("Parameter " + name + " must be positive, found " + value);
            }
        }
    }

    static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ParameterException("Parameter " + name + " should be an integer, found " + value);
        }
    }

    /**
     * Parse the command line options
     *
     * @param args
     *            command line arguments
     * @return the options
     * @throws ParameterException
     *             if the arguments are invalid or a required option is missing
     */
    public static GuardAnalysisOptions getOptions(String[] args) {
        GuardAnalysisOptions o = new GuardAnalysisOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    public String getInputFile() {
        return inputFile;
    }

    /**
     * Directory to write results (and dot files) to
     *
     * @return the output directory, null if results go to standard output
     */
    public String getOutputDir() {
        return outputDir;
    }

    public Integer getOutputLevel() {
        return outputLevel;
    }

    public Integer getFileLevel() {
        return fileLevel;
    }

    public Integer getNumThreads() {
        return numThreads;
    }

    /**
     * Should we print the useage information
     *
     * @return true if we should print useage
     */
    public boolean shouldPrintUseage() {
        return help;
    }

    public static String getUseage() {
        StringBuilder sb = new StringBuilder();
        GuardAnalysisOptions o = new GuardAnalysisOptions();
        JCommander jc = new JCommander(o);
        jc.setProgramName("GuardAnalysisMain");
        jc.getUsageFormatter().usage(sb);
        return sb.toString();
    }
}
