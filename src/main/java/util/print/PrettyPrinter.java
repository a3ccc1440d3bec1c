package util.print;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

import analysis.guards.cfg.BasicBlock;
import analysis.guards.cfg.ControlFlowGraph;
import analysis.guards.cfg.Instruction;

/**
 * Pretty printer for control flow graphs and their instructions
 */
public class PrettyPrinter {

    /**
     * Methods are static
     */
    private PrettyPrinter() {
        // intentionally blank
    }

    /**
     * Get a string for the basic block
     *
     * @param bb
     *            Basic block to write out
     * @param prefix
     *            prepend this string to each instruction (e.g. "\t" for indentation)
     * @param postfix
     *            append this string to each instruction (e.g. "\n" to place each instruction on a new line)
     * @return String for pretty printed basic block
     */
    public static String basicBlockString(BasicBlock bb, String prefix, String postfix) {
        try (StringWriter sw = new StringWriter()) {
            writeBasicBlock(bb, sw, prefix, postfix);
            return sw.toString();
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Get a string for the whole control flow graph
     *
     * @param cfg
     *            graph to print
     * @param prefix
     *            prepend this string to each instruction (e.g. "\t" for indentation)
     * @param postfix
     *            append this string to each instruction (e.g. "\n" to place each instruction on a new line)
     * @return String for pretty printed graph
     */
    public static String cfgString(ControlFlowGraph cfg, String prefix, String postfix) {
        try (StringWriter sw = new StringWriter()) {
            writeCFG(cfg, sw, prefix, postfix);
            return sw.toString();
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Write out the instructions of a basic block
     *
     * @param bb
     *            Basic block to write out
     * @param writer
     *            writer to write to
     * @param prefix
     *            prepend this string to each instruction (e.g. "\t" for indentation)
     * @param postfix
     *            append this string to each instruction (e.g. "\n" to place each instruction on a new line)
     * @throws IOException
     *             writer issues
     */
    public static void writeBasicBlock(BasicBlock bb, Writer writer, String prefix, String postfix)
                                                                                                   throws IOException {
        for (Instruction i : bb) {
            writer.write(prefix + instructionString(i) + postfix);
        }
    }

    /**
     * Write out every block of a control flow graph followed by its successors
     *
     * @param cfg
     *            graph to write out
     * @param writer
     *            writer to write to
     * @param prefix
     *            prepend this string to each instruction (e.g. "\t" for indentation)
     * @param postfix
     *            append this string to each instruction (e.g. "\n" to place each instruction on a new line)
     * @throws IOException
     *             writer issues
     */
    public static void writeCFG(ControlFlowGraph cfg, Writer writer, String prefix, String postfix)
                                                                                                   throws IOException {
        writer.write(cfg.getName() + postfix);
        for (BasicBlock bb : cfg) {
            writer.write(bb + (bb.isEntryBlock() ? " (entry)" : "") + " -> " + cfg.getSuccessors(bb) + postfix);
            writeBasicBlock(bb, writer, prefix, postfix);
        }
    }

    /**
     * String for an instruction, e.g. <code>v3 = i &lt; n</code>
     *
     * @param i
     *            instruction
     * @return string for <code>i</code>
     */
    public static String instructionString(Instruction i) {
        return i.toString();
    }

    /**
     * Name that can be used in a file name for a function
     *
     * @param name
     *            function name
     * @return <code>name</code> with characters other than letters, digits, '_', '-' and '.' replaced by '_'
     */
    public static String fileNameString(String name) {
        return name.replaceAll("[^A-Za-z0-9_.\\-]", "_");
    }
}
