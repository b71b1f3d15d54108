package cs1302.cstep.interp;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import cs1302.cstep.memory.MemoryModel;
import cs1302.cstep.trace.CType;
import cs1302.cstep.trace.TraceValue;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/** The C library functions a program can call without defining them. */
final class Builtins {

  /** Largest value {@code rand} returns. */
  static final long RAND_MAX = 0x7FFFFFFFL;

  /**
   * Where a library function is called from.
   *
   * @param function The calling function.
   * @param line The line of the call.
   */
  record CallSite(String function, int line) {}

  /** One library function. */
  @FunctionalInterface
  interface Builtin {
    TraceValue call(List<TraceValue> args, CallSite site);
  }

  private final MemoryModel memory;
  private final Map<String, Builtin> table = new HashMap<>();
  private final Map<String, CType> returnTypes = new HashMap<>();
  private long randomState;

  Builtins(MemoryModel memory, IoCollaborator console, long seed) {
    this.memory = memory;
    this.randomState = seed;

    // output and input
    define("printf", CType.INT, (args, site) -> new TraceValue.Int(console.printf(memory,
        IoCollaborator.STDOUT, string(args, 0, "printf"), args.subList(1, args.size()))));
    define("puts", CType.INT, (args, site) -> new TraceValue.Int(console.printf(memory,
        IoCollaborator.STDOUT, "%s\n", List.of(arg(args, 0, "puts")))));
    define("putchar", CType.INT, (args, site) ->
        new TraceValue.Int(console.putChar(IoCollaborator.STDOUT,
            (int) arg(args, 0, "putchar").asLong())));
    define("scanf", CType.INT, (args, site) -> new TraceValue.Int(console.scanf(memory,
        IoCollaborator.STDIN, string(args, 0, "scanf"), args.subList(1, args.size()))));
    define("getchar", CType.INT, (args, site) ->
        new TraceValue.Int(console.getChar(IoCollaborator.STDIN)));

    // heap
    define("malloc", CType.VOID_POINTER, (args, site) -> address(memory.allocate(
        arg(args, 0, "malloc").asLong(), false, site.function(), site.line())));
    define("calloc", CType.VOID_POINTER, (args, site) -> address(memory.allocate(
        arg(args, 0, "calloc").asLong() * arg(args, 1, "calloc").asLong(), true,
        site.function(), site.line())));
    define("realloc", CType.VOID_POINTER, (args, site) -> address(memory.reallocate(
        arg(args, 0, "realloc").asLong(), arg(args, 1, "realloc").asLong(), site.function(),
        site.line())));
    define("free", CType.VOID, (args, site) -> {
      memory.free(arg(args, 0, "free").asLong());
      return new TraceValue.Void();
    });
    define("exit", CType.VOID, (args, site) -> {
      throw new ProgramExit((int) arg(args, 0, "exit").asLong());
    });

    // numbers
    define("abs", CType.INT, (args, site) ->
        new TraceValue.Int(Math.abs((int) arg(args, 0, "abs").asLong())));
    define("rand", CType.INT, (args, site) -> new TraceValue.Int(nextRandom()));
    define("srand", CType.VOID, (args, site) -> {
      randomState = arg(args, 0, "srand").asLong() & 0xFFFFFFFFL;
      return new TraceValue.Void();
    });
    define("pow", CType.DOUBLE, (args, site) -> new TraceValue.Real(
        Math.pow(arg(args, 0, "pow").asDouble(), arg(args, 1, "pow").asDouble())));
    math("sqrt", Math::sqrt);
    math("floor", Math::floor);
    math("ceil", Math::ceil);
    math("fabs", Math::abs);

    // strings
    define("strlen", CType.LONG, (args, site) ->
        new TraceValue.Int(memory.readCString(arg(args, 0, "strlen").asLong()).length()));
    define("strcpy", CType.CHAR_POINTER, (args, site) -> {
      TraceValue dest = arg(args, 0, "strcpy");
      memory.writeCString(dest.asLong(), memory.readCString(arg(args, 1, "strcpy").asLong()));
      return dest;
    });
    define("strncpy", CType.CHAR_POINTER, (args, site) -> {
      TraceValue dest = arg(args, 0, "strncpy");
      String source = memory.readCString(arg(args, 1, "strncpy").asLong());
      int count = (int) arg(args, 2, "strncpy").asLong();
      byte[] chars = source.getBytes(StandardCharsets.ISO_8859_1);
      memory.writeBytes(dest.asLong(), Arrays.copyOf(chars, count));
      return dest;
    });
    define("strcat", CType.CHAR_POINTER, (args, site) -> {
      TraceValue dest = arg(args, 0, "strcat");
      String prefix = memory.readCString(dest.asLong());
      memory.writeCString(dest.asLong() + prefix.length(),
          memory.readCString(arg(args, 1, "strcat").asLong()));
      return dest;
    });
    define("strcmp", CType.INT, (args, site) -> new TraceValue.Int(compare(
        memory.readCString(arg(args, 0, "strcmp").asLong()),
        memory.readCString(arg(args, 1, "strcmp").asLong()), Integer.MAX_VALUE)));
    define("strncmp", CType.INT, (args, site) -> new TraceValue.Int(compare(
        memory.readCString(arg(args, 0, "strncmp").asLong()),
        memory.readCString(arg(args, 1, "strncmp").asLong()),
        (int) arg(args, 2, "strncmp").asLong())));
  } // Builtins

  private void define(String name, CType returnType, Builtin builtin) {
    table.put(name, builtin);
    returnTypes.put(name, returnType);
  }

  private void math(String name, DoubleUnaryOperator operator) {
    define(name, CType.DOUBLE, (args, site) ->
        new TraceValue.Real(operator.applyAsDouble(arg(args, 0, name).asDouble())));
  }

  Optional<Builtin> find(String name) {
    return Optional.ofNullable(table.get(name));
  }

  /** The declared return type of a library function, {@code int} if unknown. */
  CType returnType(String name) {
    return returnTypes.getOrDefault(name, CType.INT);
  }

  long randomState() {
    return randomState;
  }

  void setRandomState(long randomState) {
    this.randomState = randomState;
  }

  private long nextRandom() {
    randomState = (randomState * 1103515245L + 12345L) & RAND_MAX;
    return randomState;
  }

  private static TraceValue arg(List<TraceValue> args, int index, String function) {
    if (index >= args.size()) {
      throw EngineException.of(ErrorKind.UNSUPPORTED, "Too few arguments in call to '%s'",
          function);
    }
    return args.get(index);
  }

  private String string(List<TraceValue> args, int index, String function) {
    return memory.readCString(arg(args, index, function).asLong());
  }

  private static TraceValue address(long value) {
    return new TraceValue.Address(value, CType.VOID);
  }

  private static int compare(String a, String b, int limit) {
    int n = Math.min(limit, Math.max(a.length(), b.length()) + 1);
    for (int i = 0; i < n; i++) {
      int ca = i < a.length() ? a.charAt(i) & 0xFF : 0;
      int cb = i < b.length() ? b.charAt(i) & 0xFF : 0;
      if (ca != cb) {
        return ca - cb;
      } else if (ca == 0) {
        return 0;
      }
    } // for
    return 0;
  }
}
