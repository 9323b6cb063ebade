package hex.comment;

import hex.dtree.Evaluator;
import hex.dtree.FeatureRegistry;
import hex.dtree.GraphvizTreePrinter;
import hex.dtree.TextTreePrinter;
import hex.dtree.Tree;
import hex.dtree.TreeBuilder;
import hex.dtree.TreeCodec;
import hex.dtree.TreeParseException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.google.common.io.Closeables;

/**
 * Trains a comment tree or tests one.
 *
 * Training prints the tree as JSON:
 *   LearnComm -k prop comments.feats > out.tree
 * Testing loads a tree and prints precision/recall per category:
 *   LearnComm -k prop -f out.tree comments.feats
 */
public class LearnComm {
  public static final int EXIT_USAGE = 100;
  public static final int EXIT_ERROR = 1;

  // strong reference, the logging configuration lives on the logger object
  static final Logger TRACE = Logger.getLogger("hex.dtree");

  static final Option DEBUG    = Option.builder("d").desc("Print the tree and the build trace; twice for more detail.").build();
  static final Option MIN_KEYS = Option.builder("m").hasArg().argName("minkeys").desc("Minimum number of entities to split (default 10).").build();
  static final Option MIN_ETP  = Option.builder("e").hasArg().argName("minentropy").desc("Minimum entropy to split (default 0.10).").build();
  static final Option TREE     = Option.builder("f").hasArg().argName("tree").desc("Test the given tree instead of training.").build();
  static final Option KEY_PROP = Option.builder("k").hasArg().argName("keyprop").desc("Attribute holding the label (default key).").build();
  static final Option FEATS    = Option.builder("s").hasArg().argName("cat|target").desc("Feature set (default cat).").build();
  static final Option DOT      = Option.builder("g").hasArg().argName("dotfile").desc("Write the tree in Graphviz format.").build();

  static final Options OPTIONS = new Options()
    .addOption(DEBUG).addOption(MIN_KEYS).addOption(MIN_ETP).addOption(TREE)
    .addOption(KEY_PROP).addOption(FEATS).addOption(DOT);

  static class OptArgs {
    int debug;
    int minKeys = TreeBuilder.DEFAULT_MIN_KEYS;
    double minEntropy = TreeBuilder.DEFAULT_MIN_ENTROPY;
    String tree;
    String keyProp = "key";
    String feats = "cat";
    String dot;
    List<String> files = new ArrayList<String>();
  }

  static OptArgs parseArgs(String[] args) throws ParseException {
    CommandLineParser parser = new DefaultParser();
    CommandLine cl = parser.parse(OPTIONS, args);
    OptArgs a = new OptArgs();
    for( Option o : cl.getOptions() ) if( DEBUG.getOpt().equals(o.getOpt()) ) a.debug++;
    try {
      if( cl.hasOption(MIN_KEYS.getOpt()) ) a.minKeys = Integer.parseInt(cl.getOptionValue(MIN_KEYS.getOpt()));
      if( cl.hasOption(MIN_ETP.getOpt()) )  a.minEntropy = Double.parseDouble(cl.getOptionValue(MIN_ETP.getOpt()));
    } catch( NumberFormatException e ) {
      throw new ParseException("Not a number: " + e.getMessage());
    }
    if( a.minKeys < 0 ) throw new ParseException("minkeys must not be negative: " + a.minKeys);
    if( !(a.minEntropy >= 0) ) throw new ParseException("minentropy must be a non-negative number: " + a.minEntropy);
    a.tree    = cl.getOptionValue(TREE.getOpt());
    a.keyProp = cl.getOptionValue(KEY_PROP.getOpt(), a.keyProp);
    a.feats   = cl.getOptionValue(FEATS.getOpt(), a.feats);
    a.dot     = cl.getOptionValue(DOT.getOpt());
    for( String f : cl.getArgs() ) a.files.add(f);
    return a;
  }

  static void usage(PrintStream err) {
    PrintWriter pw = new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8));
    new HelpFormatter().printHelp(pw, 80, "LearnComm [options] [file ...]", null, OPTIONS, 2, 2, null);
    pw.flush();
  }

  /** Routes the build trace to {@code err} at the requested verbosity; at
   * verbosity 0 the trace is switched off again. */
  static void setupLogging(int debug, PrintStream err) {
    Logger log = TRACE;
    for( Handler h : log.getHandlers() ) {
      log.removeHandler(h);
      h.flush();
    }
    if( debug == 0 ) {
      log.setLevel(null);
      log.setUseParentHandlers(true);
      return;
    }
    Level level = debug == 1 ? Level.FINE : Level.FINER;
    StreamHandler h = new StreamHandler(err, new Formatter() {
      @Override public String format(LogRecord r) { return formatMessage(r) + "\n"; }
    }) {
      @Override public synchronized void publish(LogRecord r) {
        super.publish(r);
        flush();
      }
    };
    h.setLevel(level);
    log.addHandler(h);
    log.setLevel(level);
    log.setUseParentHandlers(false);
  }

  static List<CommentEntry> loadEntries(OptArgs a, InputStream stdin) throws IOException {
    CommentEntryLoader loader = new CommentEntryLoader(a.keyProp);
    if( a.files.isEmpty() )
      return loader.load(new InputStreamReader(stdin, StandardCharsets.UTF_8));
    List<CommentEntry> ents = new ArrayList<CommentEntry>();
    for( String f : a.files ) {
      Reader r = new InputStreamReader(new FileInputStream(f), StandardCharsets.UTF_8);
      try {
        ents.addAll(loader.load(r));
      } catch( IOException e ) {
        throw new IOException(f + ": " + e.getMessage(), e);
      } finally {
        Closeables.closeQuietly(r);
      }
    }
    return ents;
  }

  static Tree.INode loadTree(FeatureRegistry reg, String file) throws IOException, TreeParseException {
    Reader r = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8);
    try {
      return TreeCodec.parse(reg, r);
    } finally {
      Closeables.closeQuietly(r);
    }
  }

  static void writeDot(Tree t, String file) throws IOException {
    Writer w = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8);
    try {
      new GraphvizTreePrinter(w).printTree(t);
    } finally {
      w.close();
    }
  }

  /** Trains or tests as the arguments say; returns the exit status. */
  public static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
    OptArgs a;
    FeatureRegistry reg;
    try {
      a = parseArgs(args);
      reg = FeatureSets.forName(a.feats);
    } catch( ParseException e ) {
      err.println(e.getMessage());
      usage(err);
      return EXIT_USAGE;
    } catch( IllegalArgumentException e ) {
      err.println(e.getMessage());
      usage(err);
      return EXIT_USAGE;
    }
    setupLogging(a.debug, err);
    try {
      List<CommentEntry> ents = loadEntries(a, stdin);
      if( ents.isEmpty() ) {
        err.println("No entries.");
        return EXIT_ERROR;
      }
      if( a.tree == null ) {
        // training
        Tree t = new TreeBuilder(reg, a.minKeys, a.minEntropy).train(ents);
        if( a.debug > 0 ) {
          out.println();
          new TextTreePrinter(out).printTree(t);
        }
        if( a.dot != null ) writeDot(t, a.dot);
        out.println(TreeCodec.toJson(t.root()));
      } else {
        // testing
        Tree t = new Tree(loadTree(reg, a.tree));
        if( a.dot != null ) writeDot(t, a.dot);
        out.print(Evaluator.scoreAll(t, ents).report());
      }
      out.flush();
      return 0;
    } catch( IOException e ) {
      err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    } catch( TreeParseException e ) {
      err.println("Error: " + a.tree + ": " + e.getMessage());
      return EXIT_ERROR;
    }
  }

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err));
  }
}
