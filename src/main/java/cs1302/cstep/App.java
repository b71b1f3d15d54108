package cs1302.cstep;

import cs1302.cstep.interp.ControlFlow;
import cs1302.cstep.interp.ExecutionPoint;
import cs1302.cstep.interp.ExecutionState;
import cs1302.cstep.memory.AllocationInfo;
import cs1302.cstep.memory.MemoryOperation;
import cs1302.cstep.serialize.PyTutorSerializer;
import cs1302.cstep.tree.SyntaxNode;
import cs1302.cstep.tree.SyntaxTreeReader;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Scanner;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.fusesource.jansi.Ansi;
import org.fusesource.jansi.AnsiConsole;
import org.json.JSONArray;
import org.json.JSONObject;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Entry point for the stepper program. */
@Command(name = "c-stepper")
public class App {

  private static final Logger logger = LogManager.getLogger(App.class);

  public static void main(String[] args) {
    int exitCode =
        new CommandLine(new App())
            .addSubcommand(new Trace())
            .addSubcommand(new Record())
            .addSubcommand(new ListBreakpoints())
            .addSubcommand(new Leaks())
            .addSubcommand(new Operations())
            .execute(args);

    System.exit(exitCode);
  } // main

  /** Base class that holds common CLI parameters. */
  @Command
  abstract static class CommandBase implements Callable<Integer> {
    @Option(
        names = {"--verbose", "-v"},
        description = "Output messages about what the stepper is doing.")
    boolean verbose = false;

    @Option(
        names = {"--input", "-i"},
        description = "Input path to the syntax tree JSON file (defaults to stdin if omitted).")
    File input = null;

    @Option(names = "--heap-size", description = "Heap capacity in bytes.")
    long heapSize = EngineConfig.defaults().heapCapacity();

    @Option(names = "--frame-size", description = "Size budget of each stack frame in bytes.")
    int frameSize = EngineConfig.defaults().frameSize();

    @Option(names = "--recursion-limit", description = "Largest number of nested calls.")
    int recursionLimit = EngineConfig.defaults().recursionLimit();

    @Option(names = "--history", description = "Largest number of snapshots kept.")
    int history = EngineConfig.defaults().historyCapacity();

    @Option(names = "--compress", description = "Collapse identical consecutive snapshots.")
    boolean compress = false;

    @Option(names = "--entry", description = "Name of the function the program starts in.")
    String entry = EngineConfig.defaults().entryPoint();

    @Option(names = "--seed", description = "Initial state of rand().")
    long seed = EngineConfig.defaults().randomSeed();

    /** A short description of the command's work, used in the failure message. */
    abstract String task();

    abstract void execute() throws Exception;

    @Override
    public Integer call() {
      if (verbose) {
        Configurator.setLevel("cs1302.cstep", Level.DEBUG);
      } // if
      try {
        execute();
        return 0;
      } catch (Throwable cause) {
        System.err.println("Unable to " + task() + "!");
        if (cause.getMessage() != null) {
          System.err.println(cause.getMessage());
        } // if
        logger.debug("{} failed", task(), cause);
        if (verbose) {
          cause.printStackTrace();
        } // if
        return 1;
      } // try
    }

    EngineConfig config() {
      return EngineConfig.defaults()
          .withHeapCapacity(heapSize)
          .withFrameSize(frameSize)
          .withRecursionLimit(recursionLimit)
          .withHistoryCapacity(history)
          .withCompression(compress)
          .withEntryPoint(entry)
          .withRandomSeed(seed);
    }

    /**
     * Read the entirety of {@code input} into a string. If {@code input} is null, it reads and
     * returns the content of stdin.
     *
     * @return The read contents of the file.
     * @throws UncheckedIOException if an IO exception occured
     */
    protected String readInputFile() {
      if (input == null) {
        // read stdin
        StringBuilder sb = new StringBuilder();
        try (Scanner scan = new Scanner(System.in)) {
          while (scan.hasNextLine()) {
            sb.append(scan.nextLine()).append("\n");
          } // while
        } // try
        return sb.toString();
      } else {
        try {
          return Files.readString(input.toPath());
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      }
    } // readInputFile

    protected SyntaxNode readTree() {
      return SyntaxTreeReader.read(readInputFile());
    }

    /** Create a session and load the input program into it. */
    protected DebugSession loadSession(String stdin) {
      DebugSession session = new DebugSession(config());
      session.load(readTree(), input == null ? "stdin" : input.getName());
      session.provideInput(stdin);
      session.closeInput();
      return session;
    }
  }

  /** Base class for commands that run the program. */
  abstract static class RunCommand extends CommandBase {
    @Option(names = "--stdin", description = "Text given to the program as its standard input.")
    String stdin = "";

    @Option(names = "--max-steps", description = "Stop after this many steps.")
    long maxSteps = 100_000;
  }

  /** Run a trace. */
  @Command(
      name = "trace",
      description = "Generate an execution trace for a C program.",
      mixinStandardHelpOptions = true)
  static class Trace extends RunCommand {
    @Option(
        names = {"--breakpoints", "-b"},
        split = ",",
        description =
            "Breakpoints at which to take snapshots. The snapshots taken will "
                + "represent the state of memory immediately before each line is executed. "
                + "If no breakpoints are provided, every step is part of the trace.")
    List<Integer> breakpoints = null;

    @Option(
        names = {"--inline-strings", "-s"},
        description = "Show char arrays and string literals as strings.")
    boolean inlineStrings = false;

    @Option(names = "--source", description = "Path to the C source, embedded as `code`.")
    File source = null;

    @Override
    String task() {
      return "generate trace";
    }

    /** Run the program and output the resulting trace JSON to stdout. */
    @Override
    void execute() throws IOException {
      DebugSession session = loadSession(stdin);
      List<ExecutionPoint> points = new ArrayList<>();
      if (breakpoints != null) {
        breakpoints.forEach(session.recorder()::addBreakpoint);
        session.recorder().addBreakpointListener((breakpoint, snapshot) -> points.add(snapshot));
      } // if

      ExecutionPoint last = session.interpreter().current();
      for (long i = 0; i < maxSteps && !last.state().isTerminal(); i++) {
        last = session.step();
        if (breakpoints == null) {
          points.add(last);
        } // if
      } // for

      String code = source == null ? "" : Files.readString(source.toPath());
      PyTutorSerializer serializer = new PyTutorSerializer(inlineStrings, false);
      System.out.println(serializer.serialize(code, stdin, points));
    }
  }

  /** Record a run and print its timeline. */
  @Command(
      name = "record",
      description = "Run a C program and output its recorded timeline.",
      mixinStandardHelpOptions = true)
  static class Record extends RunCommand {
    @Option(
        names = {"--compact", "-c"},
        description = "Store every snapshot after the first as a diff of the one before it.")
    boolean compact = false;

    @Override
    String task() {
      return "record timeline";
    }

    @Override
    void execute() {
      DebugSession session = loadSession(stdin);
      session.run(maxSteps);
      System.out.println(session.recorder().exportTimeline(compact));
    }
  }

  /** Report leaked allocations. */
  @Command(
      name = "leaks",
      description = "Run a C program and report the allocations it never freed.",
      mixinStandardHelpOptions = true)
  static class Leaks extends RunCommand {
    @Override
    String task() {
      return "detect leaks";
    }

    @Override
    void execute() {
      DebugSession session = loadSession(stdin);
      ExecutionPoint last = session.run(maxSteps);
      JSONArray leaks = new JSONArray();
      for (AllocationInfo leak : session.leaks()) {
        leaks.put(new JSONObject()
            .put("address", String.format("0x%08x", leak.address()))
            .put("size", leak.size())
            .put("origin", leak.origin())
            .put("line", leak.line())
            .put("allocStep", leak.allocStep())
            .put("age", leak.age()));
      } // for
      JSONObject report = new JSONObject()
          .put("state", last.state().name())
          .put("steps", last.step())
          .put("leaks", leaks);
      if (last.state() == ExecutionState.COMPLETED) {
        report.put("exitCode", last.exitCode());
      } // if
      last.diagnostic().ifPresent(d -> report.put("error", d.toString()));
      System.out.println(report);
    }
  }

  /** Print the memory operation log of a run. */
  @Command(
      name = "operations",
      description = "Run a C program and print the last operations of its memory model.",
      mixinStandardHelpOptions = true)
  static class Operations extends RunCommand {
    @Option(
        names = {"--filter", "-f"},
        description = "Only show operations whose type contains this text, e.g. heap.")
    String filter = null;

    @Option(names = {"--limit", "-n"}, description = "Largest number of operations shown.")
    int limit = 100;

    @Override
    String task() {
      return "list memory operations";
    }

    @Override
    void execute() {
      DebugSession session = loadSession(stdin);
      session.run(maxSteps);
      JSONArray operations = new JSONArray();
      for (MemoryOperation operation : session.operations(limit, filter)) {
        operations.put(new JSONObject()
            .put("type", operation.type().label())
            .put("step", operation.step())
            .put("frameId", operation.frameId())
            .put("address", String.format("0x%08x", operation.address()))
            .put("detail", operation.detail()));
      } // for
      System.out.println(operations.toString(2));
    }
  }

  /** List the breakpoint lines available for a program. */
  @Command(
      name = "list-breakpoints",
      description = "List the breakpoints available in the provided program.",
      mixinStandardHelpOptions = true)
  static class ListBreakpoints extends CommandBase {
    @Option(
        names = {"--json", "-j"},
        description = "Output available breakpoints in JSON format.")
    boolean outputJson = false;

    @Option(names = "--source", description = "Path to the C source to annotate.")
    File source = null;

    @Override
    String task() {
      return "list breakpoints";
    }

    @Override
    void execute() throws IOException {
      Collection<Integer> availableBreakpoints = ControlFlow.unitLines(readTree());

      if (source == null) {
        if (outputJson) {
          System.out.println(new JSONArray(availableBreakpoints));
        } else {
          availableBreakpoints.forEach(line -> System.out.println("b " + line));
        } // if
        return;
      } // if

      String[] sourceLines = Files.readString(source.toPath()).split("\n");
      int digitLength = ((int) Math.log10(Math.max(1, sourceLines.length))) + 1;

      if (outputJson) {
        JSONArray output = new JSONArray();
        for (int i = 0; i < sourceLines.length; i++) {
          int lineNumber = i + 1;
          output.put(new JSONObject()
              .put("lineNumber", lineNumber)
              .put("validBreakpoint", availableBreakpoints.contains(lineNumber))
              .put("lineContent", sourceLines[i]));
        } // for
        System.out.println(output);
      } else {
        StringBuilder annotatedSource = new StringBuilder();
        AnsiConsole.systemInstall();
        for (int i = 0; i < sourceLines.length; i++) {

          if (availableBreakpoints.contains(i + 1)) {
            annotatedSource.append(
                Ansi.ansi().fgGreen().a(String.format("b %" + digitLength + "d | ", i + 1)));
          } else {
            annotatedSource.append(String.format("  %" + digitLength + "d | ", i + 1));
          }

          annotatedSource.append(sourceLines[i]);
          annotatedSource.append(Ansi.ansi().reset());

          if (i < sourceLines.length - 1) {
            annotatedSource.append('\n');
          } // if
        } // for
        AnsiConsole.systemUninstall();
        System.out.println(annotatedSource);
      } // if
    }
  }
}
