package com.gentoro.clm.encoder.transcript;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.config.EncodingConfiguration;
import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.resolve.RuleEvaluator;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimelineNormalizerTest {

  private TimelineNormalizer normalizer;

  @BeforeEach
  void setUp() {
    EncodingContext context = new EncodingContext(EncodingConfiguration.defaults(), Map.of());
    normalizer = new TimelineNormalizer(new RuleEvaluator(context), context.rules());
  }

  @Test
  void testRangeInWords() {
    assertEquals(Optional.of("3-5d"), normalizer.find("it will take three to five business days"));
  }

  @Test
  void testRangeInDigits() {
    assertEquals(Optional.of("3-5d"), normalizer.find("allow 3-5 business days"));
  }

  @Test
  void testWeeksAndHours() {
    assertEquals(Optional.of("2w"), normalizer.find("within 2 weeks"));
    assertEquals(Optional.of("24h"), normalizer.find("expect a reply in 24 hours"));
  }

  @Test
  void testNamedDay() {
    assertEquals(Optional.of("TOMORROW"), normalizer.find("it ships tomorrow"));
  }

  @Test
  void testNoTimeline() {
    assertTrue(normalizer.find("thanks for your patience").isEmpty());
  }
}
