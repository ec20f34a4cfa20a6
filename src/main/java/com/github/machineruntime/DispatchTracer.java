package com.github.machineruntime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Observer that rebuilds the nesting of cascaded dispatches from the flat callback stream of an
 * {@link EventMonitor}. A sent notification opens a level and the matching handled notification
 * closes it, so the open count at any notification is the depth of the dispatch that caused it.
 *
 * Each notification becomes one indented line:
 *
 * <pre>{@code
 * > transit
 *   > A:<
 *   < A:<
 *   A->B
 *   > B:>
 *   < B:>
 * < transit
 * }</pre>
 *
 * Lines are kept in memory and also logged at DEBUG.
 */
public final class DispatchTracer {
  private static final Logger logger = LogManager.getLogger(DispatchTracer.class.getSimpleName());
  private static final String indentUnit = "  ";

  private final EventMonitor eventMonitor;
  private final List<String> lines = new ArrayList<>();
  private int depth;

  private final EventCallback sentCallback = new EventCallback() {
    @Override
    public void onEvent(final MethodInstance event) {
      append("> " + event.getInfo().getName());
      depth++;
    }
  };

  private final EventCallback handledCallback = new EventCallback() {
    @Override
    public void onEvent(final MethodInstance event) {
      depth--;
      final StringBuilder line = new StringBuilder("< ").append(event.getInfo().getName());
      if (event.getReturnValue().isPresent()) {
        line.append(" = ").append(event.getReturnValue().get());
      }
      append(line.toString());
    }
  };

  private final TransitionCallback transitionCallback = new TransitionCallback() {
    @Override
    public void onTransition(final TransitionInstance transition) {
      append(transition.toString());
    }
  };

  private DispatchTracer(final EventMonitor eventMonitor) {
    this.eventMonitor = eventMonitor;
  }

  /**
   * Start tracing the given monitor. Dispatches already in flight when tracing starts are not
   * accounted for, so attach between dispatches.
   */
  public static DispatchTracer attach(final EventMonitor eventMonitor) {
    final DispatchTracer tracer = new DispatchTracer(eventMonitor);
    eventMonitor.addEventSentCallback(tracer.sentCallback);
    eventMonitor.addEventHandledCallback(tracer.handledCallback);
    eventMonitor.addTransitionCallback(tracer.transitionCallback);
    return tracer;
  }

  /**
   * Stop tracing. The lines recorded so far are kept.
   */
  public void detach() {
    eventMonitor.removeEventSentCallback(sentCallback);
    eventMonitor.removeEventHandledCallback(handledCallback);
    eventMonitor.removeTransitionCallback(transitionCallback);
  }

  public List<String> getLines() {
    return Collections.unmodifiableList(new ArrayList<>(lines));
  }

  /**
   * Number of dispatches currently open.
   */
  public int getDepth() {
    return depth;
  }

  public void clear() {
    lines.clear();
  }

  private void append(final String text) {
    final StringBuilder line = new StringBuilder();
    for (int level = 0; level < depth; level++) {
      line.append(indentUnit);
    }
    line.append(text);
    lines.add(line.toString());
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(eventMonitor.getId()).append("] ")
          .append(line).toString());
    }
  }

  @Override
  public String toString() {
    return String.join("\n", lines);
  }
}
