package cs1302.cstep.interp;

import cs1302.cstep.memory.MemoryModel;
import cs1302.cstep.trace.TraceValue;
import java.util.List;

/**
 * Formatted input and output of the simulated program. Implementations read and write program
 * memory only through the {@link MemoryModel}.
 *
 * <p>Handles {@code 0}, {@code 1} and {@code 2} are standard input, output and error.
 */
public interface IoCollaborator {

  int STDIN = 0;
  int STDOUT = 1;
  int STDERR = 2;

  /** Returned when input is exhausted or a handle is unusable. */
  int EOF = -1;

  /**
   * Format values and write them to an output handle.
   *
   * @param memory The memory strings are read from.
   * @param handle The output handle.
   * @param format The format string.
   * @param args The values for the conversions of {@code format}.
   * @return The number of characters written, or {@link #EOF}.
   */
  int printf(MemoryModel memory, int handle, String format, List<TraceValue> args);

  /**
   * Read items from an input handle and store them at the given addresses.
   *
   * @param memory The memory the items are written to.
   * @param handle The input handle.
   * @param format The format string.
   * @param targets The addresses for the conversions of {@code format}.
   * @return The number of items stored, or {@link #EOF} if input ended before the first item.
   * @throws InputRequired if more input is needed and may still arrive
   */
  int scanf(MemoryModel memory, int handle, String format, List<TraceValue> targets);

  /**
   * Write one character.
   *
   * @param handle The output handle.
   * @param c The character.
   * @return The character written, or {@link #EOF}.
   */
  int putChar(int handle, int c);

  /**
   * Read one character.
   *
   * @param handle The input handle.
   * @return The character, or {@link #EOF}.
   * @throws InputRequired if no input is available yet
   */
  int getChar(int handle);

  /**
   * Append text to standard input.
   *
   * @param text The text.
   */
  void provideInput(String text);

  /** Mark the end of standard input; reads past the end return {@link #EOF}. */
  void closeInput();

  /**
   * Capture the output written and the input consumed so far.
   *
   * @return The capture.
   */
  ConsoleState state();

  /**
   * Go back to a captured state.
   *
   * @param state A state returned by {@link #state()}.
   */
  void restore(ConsoleState state);
}
