package com.acme.fabric.web.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.slf4j.MDC;
import org.slf4j.Marker;

/**
 * Keeps the current thread id in MDC so the log pattern can show which request thread or Kafka
 * listener thread wrote a line. Never filters anything out.
 */
public class ThreadIdTurboFilter extends TurboFilter {
  public static final String THREAD_ID_KEY = "threadId";

  @Override
  public FilterReply decide(
      Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
    String threadId = String.valueOf(Thread.currentThread().getId());
    if (!threadId.equals(MDC.get(THREAD_ID_KEY))) {
      MDC.put(THREAD_ID_KEY, threadId);
    }
    return FilterReply.NEUTRAL;
  }
}
