package cs1302.cstep.interp;

import cs1302.cstep.EngineException;
import cs1302.cstep.ErrorKind;
import cs1302.cstep.memory.MemoryModel;
import cs1302.cstep.trace.CType;
import cs1302.cstep.trace.TraceValue;
import java.util.List;
import java.util.Locale;

/**
 * An {@link IoCollaborator} that keeps standard output and error in memory and reads standard
 * input from text supplied with {@link #provideInput}. Input is never discarded, so restoring an
 * earlier state replays the same input.
 */
public class BufferedConsole implements IoCollaborator {

  private static final CType SHORT = new CType("short", 0, List.of());
  private static final CType LONG_LONG = new CType("long long", 0, List.of());

  private final StringBuilder stdout = new StringBuilder();
  private final StringBuilder stderr = new StringBuilder();
  private final StringBuilder input = new StringBuilder();
  private int inputPosition = 0;
  private boolean inputClosed = false;

  /** One parsed conversion specification, e.g. {@code %-08.3lf}. */
  private record Spec(String flags, int width, int precision, String length, char conversion) {

    boolean has(char flag) {
      return flags.indexOf(flag) >= 0;
    }
  }

  public String stdout() {
    return stdout.toString();
  }

  public String stderr() {
    return stderr.toString();
  }

  @Override
  public void provideInput(String text) {
    input.append(text);
  }

  @Override
  public void closeInput() {
    inputClosed = true;
  }

  @Override
  public ConsoleState state() {
    return new ConsoleState(stdout.toString(), stderr.toString(), inputPosition);
  }

  @Override
  public void restore(ConsoleState state) {
    stdout.setLength(0);
    stdout.append(state.stdout());
    stderr.setLength(0);
    stderr.append(state.stderr());
    inputPosition = Math.min(state.inputPosition(), input.length());
  }

  @Override
  public int putChar(int handle, int c) {
    return write(handle, String.valueOf((char) (c & 0xFF))) == EOF ? EOF : c & 0xFF;
  }

  @Override
  public int getChar(int handle) {
    if (handle != STDIN) {
      return EOF;
    }
    if (inputPosition < input.length()) {
      return input.charAt(inputPosition++) & 0xFF;
    } else if (inputClosed) {
      return EOF;
    }
    throw new InputRequired("getchar needs input");
  }

  private int write(int handle, String text) {
    if (handle == STDOUT) {
      stdout.append(text);
    } else if (handle == STDERR) {
      stderr.append(text);
    } else {
      return EOF;
    }
    return text.length();
  }

  // ---------------------------------------------------------------- output

  @Override
  public int printf(MemoryModel memory, int handle, String format, List<TraceValue> args) {
    StringBuilder out = new StringBuilder();
    int next = 0;
    int i = 0;
    while (i < format.length()) {
      char c = format.charAt(i);
      if (c != '%') {
        out.append(c);
        i++;
        continue;
      }
      if (i + 1 < format.length() && format.charAt(i + 1) == '%') {
        out.append('%');
        i += 2;
        continue;
      }
      int[] cursor = {i + 1};
      Spec spec = parseSpec(format, cursor, args, next);
      if (spec == null) {
        out.append(format.substring(i));
        break;
      }
      next += starCount(format, i + 1, cursor[0]);
      TraceValue arg = next < args.size() ? args.get(next) : new TraceValue.Int(0);
      next++;
      out.append(formatOne(memory, spec, arg));
      i = cursor[0];
    } // while
    return write(handle, out.toString()) == EOF ? EOF : out.length();
  } // printf

  private static int starCount(String format, int from, int to) {
    int count = 0;
    for (int i = from; i < to; i++) {
      if (format.charAt(i) == '*') {
        count++;
      }
    } // for
    return count;
  }

  /** Parse the specification that starts after a {@code %}; {@code cursor[0]} is advanced. */
  private static Spec parseSpec(String format, int[] cursor, List<TraceValue> args, int next) {
    int i = cursor[0];
    StringBuilder flags = new StringBuilder();
    while (i < format.length() && "-+ #0".indexOf(format.charAt(i)) >= 0) {
      flags.append(format.charAt(i++));
    } // while
    int width = -1;
    if (i < format.length() && format.charAt(i) == '*') {
      width = next < args.size() ? (int) args.get(next++).asLong() : 0;
      i++;
    } else {
      int start = i;
      while (i < format.length() && Character.isDigit(format.charAt(i))) {
        i++;
      } // while
      width = i > start ? Integer.parseInt(format.substring(start, i)) : -1;
    }
    int precision = -1;
    if (i < format.length() && format.charAt(i) == '.') {
      i++;
      if (i < format.length() && format.charAt(i) == '*') {
        precision = next < args.size() ? (int) args.get(next).asLong() : 0;
        i++;
      } else {
        int start = i;
        while (i < format.length() && Character.isDigit(format.charAt(i))) {
          i++;
        } // while
        precision = i > start ? Integer.parseInt(format.substring(start, i)) : 0;
      }
    } // if
    int lengthStart = i;
    while (i < format.length() && "hlLzjt".indexOf(format.charAt(i)) >= 0) {
      i++;
    } // while
    String length = format.substring(lengthStart, i);
    if (i >= format.length()) {
      return null;
    }
    char conversion = format.charAt(i++);
    cursor[0] = i;
    if (width < 0 && flags.indexOf("-") < 0 && width != -1) {
      flags.append('-');
    }
    return new Spec(flags.toString(), Math.abs(width == -1 ? 0 : width), precision, length,
        conversion);
  } // parseSpec

  private static String formatOne(MemoryModel memory, Spec spec, TraceValue arg) {
    boolean wide = spec.length().startsWith("l") || spec.length().equals("z")
        || spec.length().equals("j");
    return switch (spec.conversion()) {
      case 'd', 'i' -> {
        long v = narrow(arg.asLong(), spec.length(), wide);
        yield number(spec, v < 0 ? "-" : "", digits(Long.toString(Math.abs(v)), spec), true);
      }
      case 'u' -> number(spec, "", digits(Long.toUnsignedString(unsigned(arg, spec, wide)), spec),
          false);
      case 'x', 'X' -> {
        String hex = Long.toHexString(unsigned(arg, spec, wide));
        String prefix = spec.has('#') && !hex.equals("0") ? "0x" : "";
        String body = number(spec, prefix, digits(hex, spec), false);
        yield spec.conversion() == 'X' ? body.toUpperCase(Locale.ROOT) : body;
      }
      case 'o' -> number(spec, spec.has('#') ? "0" : "",
          digits(Long.toOctalString(unsigned(arg, spec, wide)), spec), false);
      case 'c' -> pad(spec, String.valueOf((char) (arg.asLong() & 0xFF)));
      case 's' -> {
        String text = arg instanceof TraceValue.Address a && a.isNull()
            ? "(null)"
            : memory.readCString(arg.asLong());
        if (spec.precision() >= 0 && text.length() > spec.precision()) {
          text = text.substring(0, spec.precision());
        }
        yield pad(spec, text);
      }
      case 'p' -> pad(spec, arg.asLong() == 0 ? "(nil)" : "0x" + Long.toHexString(arg.asLong()));
      case 'f', 'F', 'e', 'E', 'g', 'G' -> floating(spec, arg.asDouble());
      default -> throw EngineException.of(ErrorKind.UNSUPPORTED,
          "Unsupported conversion '%%%c' in format", spec.conversion());
    };
  } // formatOne

  private static long narrow(long v, String length, boolean wide) {
    if (wide) {
      return v;
    }
    return switch (length) {
      case "hh" -> (byte) v;
      case "h" -> (short) v;
      default -> (int) v;
    };
  }

  private static long unsigned(TraceValue arg, Spec spec, boolean wide) {
    long v = arg.asLong();
    if (wide) {
      return v;
    }
    return switch (spec.length()) {
      case "hh" -> v & 0xFFL;
      case "h" -> v & 0xFFFFL;
      default -> v & 0xFFFFFFFFL;
    };
  }

  /** Apply the precision of an integer conversion (minimum number of digits). */
  private static String digits(String digits, Spec spec) {
    if (spec.precision() < 0) {
      return digits;
    }
    if (spec.precision() == 0 && digits.equals("0")) {
      return "";
    }
    return "0".repeat(Math.max(0, spec.precision() - digits.length())) + digits;
  }

  private static String number(Spec spec, String prefix, String digits, boolean signed) {
    String sign = prefix;
    if (signed && prefix.isEmpty()) {
      sign = spec.has('+') ? "+" : spec.has(' ') ? " " : "";
    }
    int missing = spec.width() - sign.length() - digits.length();
    if (missing > 0 && spec.has('0') && !spec.has('-') && spec.precision() < 0) {
      return sign + "0".repeat(missing) + digits;
    }
    return pad(spec, sign + digits);
  }

  private static String floating(Spec spec, double value) {
    char conversion = spec.conversion();
    boolean upper = Character.isUpperCase(conversion);
    String sign = value < 0 || (value == 0 && 1 / value < 0) ? "-"
        : spec.has('+') ? "+" : spec.has(' ') ? " " : "";
    double magnitude = Math.abs(value);
    String body;
    if (Double.isNaN(value)) {
      body = "nan";
      sign = "";
    } else if (Double.isInfinite(value)) {
      body = "inf";
    } else {
      int precision = spec.precision() < 0 ? 6 : spec.precision();
      body = switch (Character.toLowerCase(conversion)) {
        case 'f' -> String.format(Locale.ROOT, "%." + precision + "f", magnitude);
        case 'e' -> String.format(Locale.ROOT, "%." + precision + "e", magnitude);
        default -> general(magnitude, precision, spec.has('#'));
      };
    }
    if (upper) {
      body = body.toUpperCase(Locale.ROOT);
    }
    int missing = spec.width() - sign.length() - body.length();
    if (missing > 0 && spec.has('0') && !spec.has('-') && Double.isFinite(value)) {
      return sign + "0".repeat(missing) + body;
    }
    return pad(spec, sign + body);
  } // floating

  /** The {@code %g} conversion: {@code %e} or {@code %f}, trailing zeros removed. */
  private static String general(double magnitude, int precision, boolean keepZeros) {
    int p = precision == 0 ? 1 : precision;
    String scientific = String.format(Locale.ROOT, "%." + (p - 1) + "e", magnitude);
    int exponent = Integer.parseInt(scientific.substring(scientific.indexOf('e') + 1));
    String body;
    if (exponent < p && exponent >= -4) {
      body = String.format(Locale.ROOT, "%." + (p - 1 - exponent) + "f", magnitude);
      if (!keepZeros && body.contains(".")) {
        body = body.replaceAll("0+$", "").replaceAll("\\.$", "");
      }
    } else {
      body = scientific;
      if (!keepZeros) {
        String mantissa = body.substring(0, body.indexOf('e'));
        if (mantissa.contains(".")) {
          mantissa = mantissa.replaceAll("0+$", "").replaceAll("\\.$", "");
        }
        body = mantissa + body.substring(body.indexOf('e'));
      }
    }
    return body;
  } // general

  private static String pad(Spec spec, String text) {
    int missing = spec.width() - text.length();
    if (missing <= 0) {
      return text;
    }
    return spec.has('-') ? text + " ".repeat(missing) : " ".repeat(missing) + text;
  }

  // ---------------------------------------------------------------- input

  @Override
  public int scanf(MemoryModel memory, int handle, String format, List<TraceValue> targets) {
    if (handle != STDIN) {
      return EOF;
    }
    int pos = inputPosition;
    int assigned = 0;
    int target = 0;
    int i = 0;
    scan:
    while (i < format.length()) {
      char c = format.charAt(i);
      if (Character.isWhitespace(c)) {
        pos = skipWhitespace(pos);
        i++;
        continue;
      }
      if (c != '%' || (i + 1 < format.length() && format.charAt(i + 1) == '%')) {
        if (pos >= input.length()) {
          return needMore(pos, assigned);
        }
        if (input.charAt(pos) != c) {
          break;
        }
        pos++;
        i += c == '%' ? 2 : 1;
        continue;
      }
      i++;
      boolean suppress = i < format.length() && format.charAt(i) == '*';
      if (suppress) {
        i++;
      }
      int start = i;
      while (i < format.length() && Character.isDigit(format.charAt(i))) {
        i++;
      } // while
      int width = i > start ? Integer.parseInt(format.substring(start, i)) : Integer.MAX_VALUE;
      int lengthStart = i;
      while (i < format.length() && "hlLjz".indexOf(format.charAt(i)) >= 0) {
        i++;
      } // while
      String length = format.substring(lengthStart, i);
      if (i >= format.length()) {
        break;
      }
      char conversion = format.charAt(i++);
      if (conversion != 'c') {
        pos = skipWhitespace(pos);
      }
      if (pos >= input.length()) {
        return needMore(pos, assigned);
      }

      String token;
      switch (conversion) {
        case 'd', 'i', 'u' -> token = scanToken(pos, width, "+-", "0123456789");
        case 'x', 'X' -> token = scanToken(pos, width, "+-", "0123456789abcdefABCDEFxX");
        case 'o' -> token = scanToken(pos, width, "+-", "01234567");
        case 'f', 'e', 'g', 'E', 'G' -> token = scanToken(pos, width, "+-", "0123456789.eE+-");
        case 's' -> {
          int end = pos;
          while (end < input.length() && end - pos < width
              && !Character.isWhitespace(input.charAt(end))) {
            end++;
          } // while
          token = input.substring(pos, end);
        }
        case 'c' -> {
          int count = width == Integer.MAX_VALUE ? 1 : width;
          if (pos + count > input.length()) {
            return needMore(pos, assigned);
          }
          token = input.substring(pos, pos + count);
        }
        default -> throw EngineException.of(ErrorKind.UNSUPPORTED,
            "Unsupported conversion '%%%c' in scanf format", conversion);
      }
      if (token.isEmpty() || token.equals("+") || token.equals("-")) {
        break scan;
      }
      pos += token.length();
      if (suppress) {
        continue;
      }
      if (target >= targets.size()) {
        throw EngineException.of(ErrorKind.UNSUPPORTED,
            "scanf format has more conversions than arguments");
      }
      long address = targets.get(target++).asLong();
      store(memory, address, conversion, length, token);
      assigned++;
    } // while
    inputPosition = pos;
    return assigned;
  } // scanf

  private int needMore(int pos, int assigned) {
    if (inputClosed) {
      inputPosition = pos;
      return assigned == 0 ? EOF : assigned;
    }
    throw new InputRequired("scanf needs input");
  }

  private int skipWhitespace(int pos) {
    while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
      pos++;
    } // while
    return pos;
  }

  private String scanToken(int pos, int width, String signs, String body) {
    int end = pos;
    if (end < input.length() && signs.indexOf(input.charAt(end)) >= 0) {
      end++;
    }
    while (end < input.length() && end - pos < width && body.indexOf(input.charAt(end)) >= 0) {
      char c = input.charAt(end);
      // a sign inside a float is only valid right after the exponent marker
      if ((c == '+' || c == '-') && Character.toLowerCase(input.charAt(end - 1)) != 'e') {
        break;
      }
      end++;
    } // while
    return input.substring(pos, end);
  }

  private static void store(MemoryModel memory, long address, char conversion, String length,
      String token) {
    switch (conversion) {
      case 'd', 'i', 'u', 'x', 'X', 'o' -> {
        int radix = switch (conversion) {
          case 'x', 'X' -> 16;
          case 'o' -> 8;
          default -> 10;
        };
        String digits = token;
        boolean negative = digits.startsWith("-");
        if (negative || digits.startsWith("+")) {
          digits = digits.substring(1);
        }
        if (radix == 16 && digits.toLowerCase(Locale.ROOT).startsWith("0x")) {
          digits = digits.substring(2);
        }
        long value = digits.isEmpty() ? 0 : Long.parseLong(digits, radix);
        CType type = switch (length) {
          case "hh" -> CType.CHAR;
          case "h" -> SHORT;
          case "l" -> CType.LONG;
          case "ll", "j", "z" -> LONG_LONG;
          default -> CType.INT;
        };
        memory.writeValue(address, type, new TraceValue.Int(negative ? -value : value));
      }
      case 'f', 'e', 'g', 'E', 'G' -> {
        double value;
        try {
          value = Double.parseDouble(token);
        } catch (NumberFormatException e) {
          value = 0;
        }
        CType type = length.startsWith("l") || length.equals("L") ? CType.DOUBLE : CType.FLOAT;
        memory.writeValue(address, type, new TraceValue.Real(value));
      }
      case 'c' -> memory.writeBytes(address,
          token.getBytes(java.nio.charset.StandardCharsets.ISO_8859_1));
      default -> memory.writeCString(address, token);
    }
  } // store
}
