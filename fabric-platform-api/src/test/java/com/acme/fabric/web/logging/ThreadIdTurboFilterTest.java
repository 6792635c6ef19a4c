package com.acme.fabric.web.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ThreadIdTurboFilterTest {

  @AfterEach
  void clearMdc() {
    MDC.remove(ThreadIdTurboFilter.THREAD_ID_KEY);
  }

  @Test
  void testPutsThreadIdAndStaysNeutral() {
    FilterReply reply = new ThreadIdTurboFilter().decide(null, null, Level.INFO, "msg", null, null);

    assertThat(reply).isEqualTo(FilterReply.NEUTRAL);
    assertThat(MDC.get(ThreadIdTurboFilter.THREAD_ID_KEY))
        .isEqualTo(String.valueOf(Thread.currentThread().getId()));
  }

  @Test
  void testOverwritesStaleThreadId() {
    MDC.put(ThreadIdTurboFilter.THREAD_ID_KEY, "-1");

    new ThreadIdTurboFilter().decide(null, null, Level.DEBUG, "msg", null, null);

    assertThat(MDC.get(ThreadIdTurboFilter.THREAD_ID_KEY))
        .isEqualTo(String.valueOf(Thread.currentThread().getId()));
  }
}
