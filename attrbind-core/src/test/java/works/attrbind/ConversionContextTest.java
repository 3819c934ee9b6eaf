package works.attrbind;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversionContextTest {

	@Test
	void background_isNeverDone() {
		ConversionContext ctx = ConversionContext.background();
		assertFalse(ctx.isDone());
		assertNull(ctx.reason());
		assertThrows(UnsupportedOperationException.class, ctx::cancel);
	}

	@Test
	void cancel_isSeenByChildren() {
		ConversionContext parent = ConversionContext.background().withCancel();
		ConversionContext child = parent.withCancel();
		parent.cancel();
		assertTrue(child.isDone());
		assertEquals(ConversionContext.CANCELED, child.reason());
	}

	@Test
	void cancelChild_leavesParentActive() {
		ConversionContext parent = ConversionContext.background().withCancel();
		ConversionContext child = parent.withCancel();
		child.cancel();
		assertTrue(child.isDone());
		assertFalse(parent.isDone());
	}

	@Test
	void pastDeadline_isDone() {
		Instant now = Instant.parse("2024-01-01T00:00:00Z");
		ConversionContext ctx = ConversionContext.background()
			.withClock(Clock.fixed(now, ZoneOffset.UTC))
			.withDeadline(now);
		assertTrue(ctx.isDone());
		assertEquals(ConversionContext.DEADLINE_EXCEEDED, ctx.reason());
	}

	@Test
	void futureTimeout_isNotDone() {
		Instant now = Instant.parse("2024-01-01T00:00:00Z");
		ConversionContext ctx = ConversionContext.background()
			.withClock(Clock.fixed(now, ZoneOffset.UTC))
			.withTimeout(Duration.ofSeconds(5));
		assertFalse(ctx.isDone());
		assertEquals(now.plusSeconds(5), ctx.deadline());
	}

	@Test
	void deadline_isEarliestInChain() {
		Instant early = Instant.parse("2030-01-01T00:00:00Z");
		Instant late = Instant.parse("2031-01-01T00:00:00Z");
		ConversionContext ctx = ConversionContext.background().withDeadline(early).withDeadline(late);
		assertEquals(early, ctx.deadline());
	}

}
