package util.print;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;

import analysis.guards.cfg.BasicBlock;
import analysis.guards.cfg.ConditionalBranchInstruction;
import analysis.guards.cfg.ControlFlowGraph;
import analysis.guards.cfg.Instruction;

/**
 * Write out a control flow graph in graphviz dot format
 */
public class CFGWriter {

    /**
     * Graph to be written
     */
    private final ControlFlowGraph cfg;
    /**
     * If true then code will be included in CFG, otherwise it will just be basic block numbers
     */
    private boolean verbose;
    /**
     * Holds the string representation of the basic blocks
     */
    private final Map<BasicBlock, String> bbStrings = new HashMap<>();
    /**
     * String to prepend to instructions
     */
    private String prefix;
    /**
     * String to append to instructions
     */
    private String postfix;

    /**
     * Create a writer for the given graph
     *
     * @param cfg
     *            control flow graph to be printed
     */
    public CFGWriter(ControlFlowGraph cfg) {
        assert cfg != null : "Cannot print null CFG";
        this.cfg = cfg;
    }

    /**
     * Write out the graph to the given writer
     *
     * @param writer
     *            writer to write the code to
     * @param prefix
     *            prepended to each instruction (e.g. "\t" to indent)
     * @param postfix
     *            append this string to each instruction (e.g. "\n" to place each instruction on a new line)
     * @throws IOException
     *             writer issues
     */
    public final void write(Writer writer, String prefix, String postfix) throws IOException {
        this.prefix = prefix;
        this.postfix = postfix;
        double spread = 1.0;
        writer.write("digraph G {\n" + "node [shape=record];\n" + "nodesep=" + spread + ";\n" + "ranksep=" + spread
                                        + ";\n" + "graph [fontsize=10]" + ";\n" + "node [fontsize=10]" + ";\n"
                                        + "edge [fontsize=10]" + ";\n");

        writeGraph(writer);

        writer.write("\n};\n");
    }

    /**
     * Write out the control flow graph in graphviz dot format with the code for the basic block written on each node.
     *
     * @param writer
     *            writer to write the code to
     * @param prefix
     *            prepended to each instruction (e.g. "\t" to indent)
     * @param postfix
     *            append this string to each instruction (e.g. "\n" to place each instruction on a new line)
     * @throws IOException
     *             writer issues
     */
    public final void writeVerbose(Writer writer, String prefix, String postfix) throws IOException {
        this.verbose = true;
        write(writer, prefix, postfix);
    }

    /**
     * Write the cfg to a dot file in the given directory with the filename equal to the function name prepended with
     * "cfg_"
     *
     * @param cfg
     *            graph to write
     * @param directory
     *            directory to write the file to
     * @return name of the file written, null if it could not be written
     */
    public static final String writeToFile(ControlFlowGraph cfg, String directory) {
        CFGWriter writer = new CFGWriter(cfg);
        String fullFilename = directory + "/cfg_" + PrettyPrinter.fileNameString(cfg.getName()) + ".dot";
        try (Writer out = new BufferedWriter(new FileWriter(fullFilename))) {
            writer.writeVerbose(out, "", "\\l");
            System.err.println("DOT written to: " + fullFilename);
            return fullFilename;
        } catch (IOException e) {
            System.err.println("Could not write DOT to file, " + fullFilename + ", " + e.getMessage());
            return null;
        }
    }

    /**
     * Write all the edges in the CFG to the given writer
     *
     * @param writer
     *            writer to write the graph to
     * @throws IOException
     *             writer issues
     */
    private void writeGraph(Writer writer) throws IOException {
        for (BasicBlock current : cfg) {
            String currentString = getStringForBasicBlock(current);
            if (cfg.getSuccessors(current).isEmpty() && cfg.getPredecessors(current).isEmpty()) {
                writer.write("\t\"" + currentString + "\";\n");
            }
            for (BasicBlock succ : cfg.getSuccessors(current)) {
                String edge = getEdgeLabel(current, succ);
                if (!cfg.isReachableFromEntry(current)) {
                    edge = "UNREACHABLE " + edge;
                }
                String succString = getStringForBasicBlock(succ);
                String edgeLabel = "[label=\"" + edge + "\"]";
                writer.write("\t\"" + currentString + "\" -> \"" + succString + "\" " + edgeLabel + ";\n");
            }
        }
    }

    /**
     * Get the string representation of the basic block
     *
     * @param bb
     *            basic block to get a string for
     * @return string for <code>bb</code>
     */
    private String getStringForBasicBlock(BasicBlock bb) {
        String bbString = bbStrings.get(bb);
        if (bbString == null) {
            StringBuilder sb = new StringBuilder();
            sb.append("BB" + bb.getNumber() + "\\l");
            if (bb.isEntryBlock()) {
                sb.append("ENTRY\\l");
            }
            if (verbose) {
                for (Instruction i : bb) {
                    sb.append(prefix + PrettyPrinter.instructionString(i) + postfix);
                }
            }
            bbString = escapeDot(sb.toString());
            bbStrings.put(bb, bbString);
        }
        return bbString;
    }

    /**
     * Properly escape the string so it will be properly formatted in dot
     *
     * @param s
     *            string to escape
     * @return dot-safe string
     */
    private static String escapeDot(String s) {
        return s.replace("\"", "\\\"").replace("\n", "\\l");
    }

    /**
     * Label for an edge, the truth value for edges out of a conditional branch
     *
     * @param source
     *            source of the edge
     * @param target
     *            target of the edge
     * @return label
     */
    private static String getEdgeLabel(BasicBlock source, BasicBlock target) {
        Instruction last = source.getLastInstruction();
        if (last instanceof ConditionalBranchInstruction) {
            ConditionalBranchInstruction br = (ConditionalBranchInstruction) last;
            if (br.getTrueTarget() == target && br.getFalseTarget() == target) {
                return "TRUE/FALSE";
            }
            if (br.getTrueTarget() == target) {
                return "TRUE";
            }
            if (br.getFalseTarget() == target) {
                return "FALSE";
            }
            throw new RuntimeException("Something besides a true or false successor for a branch.");
        }
        return "NORMAL";
    }
}
