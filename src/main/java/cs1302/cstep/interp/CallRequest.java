package cs1302.cstep.interp;

import cs1302.cstep.trace.TraceValue;
import cs1302.cstep.tree.SyntaxNode;
import java.util.List;

/**
 * Raised while evaluating a statement that calls a user function whose result is not known yet.
 * The step that raised it pushes the callee's frame instead of completing the statement.
 */
class CallRequest extends RuntimeException {

  private final SyntaxNode site;
  private final SyntaxNode function;
  private final List<TraceValue> arguments;

  CallRequest(SyntaxNode site, SyntaxNode function, List<TraceValue> arguments) {
    super("call " + function.value(), null, false, false);
    this.site = site;
    this.function = function;
    this.arguments = List.copyOf(arguments);
  }

  /** The {@code CALL_EXPR} that made the call. */
  SyntaxNode site() {
    return site;
  }

  SyntaxNode function() {
    return function;
  }

  List<TraceValue> arguments() {
    return arguments;
  }

  int line() {
    return site.line();
  }
}
