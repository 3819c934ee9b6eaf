package works.attrbind;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Carries cancellation and deadline information through a conversion.
 * <p>
 * Every conversion operation, and every collaborator it calls
 * (attribute types, validation hooks, nested conversions), receives a context.
 * Long-running work should check {@link #isDone()} and stop promptly once it returns true.
 * <p>
 * Contexts form a tree: a context derived with {@link #withCancel()},
 * {@link #withDeadline} or {@link #withTimeout} is done whenever its parent is done,
 * and can additionally be done on its own account.
 * <p>
 * Thread-safe: a context may be cancelled from a different thread than the one converting.
 */
public final class ConversionContext {
	public static final String CANCELED = "context canceled";
	public static final String DEADLINE_EXCEEDED = "context deadline exceeded";

	private static final ConversionContext BACKGROUND = new ConversionContext(null, null, false, Clock.systemUTC());

	private final @Nullable ConversionContext parent;
	private final @Nullable Instant deadline;
	private final boolean cancellable;
	private final Clock clock;
	private final AtomicReference<String> cancelReason = new AtomicReference<>();

	private ConversionContext(@Nullable ConversionContext parent, @Nullable Instant deadline, boolean cancellable, Clock clock) {
		this.parent = parent;
		this.deadline = deadline;
		this.cancellable = cancellable;
		this.clock = clock;
	}

	/**
	 * @return a context that is never done
	 */
	public static ConversionContext background() {
		return BACKGROUND;
	}

	/**
	 * @return a child of this context that can be {@link #cancel() cancelled}
	 */
	public ConversionContext withCancel() {
		return new ConversionContext(this, null, true, clock);
	}

	/**
	 * @return a cancellable child of this context that is done at the given instant
	 */
	public ConversionContext withDeadline(Instant deadline) {
		return new ConversionContext(this, requireNonNull(deadline), true, clock);
	}

	public ConversionContext withTimeout(Duration timeout) {
		return withDeadline(clock.instant().plus(timeout));
	}

	/**
	 * Uses the given clock for deadline calculations in this context and those derived from it.
	 */
	public ConversionContext withClock(Clock clock) {
		return new ConversionContext(this, null, cancellable, requireNonNull(clock));
	}

	/**
	 * Marks this context, and all contexts derived from it, as done.
	 * Has no effect if this context is already done.
	 *
	 * @throws UnsupportedOperationException if this context was not created with {@link #withCancel()},
	 * {@link #withDeadline}, or {@link #withTimeout}
	 */
	public void cancel() {
		if (!cancellable) {
			throw new UnsupportedOperationException("Context is not cancellable");
		}
		cancelReason.compareAndSet(null, CANCELED);
	}

	public boolean isDone() {
		return reason() != null;
	}

	/**
	 * @return why this context is done, or null if it isn't
	 */
	public @Nullable String reason() {
		String own = cancelReason.get();
		if (own != null) {
			return own;
		}
		if (deadline != null && !clock.instant().isBefore(deadline)) {
			cancelReason.compareAndSet(null, DEADLINE_EXCEEDED);
			return cancelReason.get();
		}
		if (parent != null) {
			return parent.reason();
		}
		return null;
	}

	public @Nullable Instant deadline() {
		Instant parentDeadline = (parent == null) ? null : parent.deadline();
		if (deadline == null) {
			return parentDeadline;
		} else if (parentDeadline == null || deadline.isBefore(parentDeadline)) {
			return deadline;
		} else {
			return parentDeadline;
		}
	}

	@Override
	public String toString() {
		String reason = reason();
		return "ConversionContext(" + (reason == null ? "active" : reason) + ")";
	}
}
