package io.subtracker.billing.exception;

import lombok.Getter;

/**
 * A billing write asked for something that cannot be recorded, such as a non-positive payment.
 */
@Getter
public class NotValidException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient Object rejectedValue;

	public NotValidException(String reason, Object rejectedValue) {
		super(String.format("%s (was %s)", reason, rejectedValue));
		this.rejectedValue = rejectedValue;
	}
}
