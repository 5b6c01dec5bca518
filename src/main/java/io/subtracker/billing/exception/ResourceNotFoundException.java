package io.subtracker.billing.exception;

import io.subtracker.billing.util.ConstantUtility;
import lombok.Getter;

@Getter
public class ResourceNotFoundException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String resourceName;

	private final Long resourceId;

	public ResourceNotFoundException(String resourceName, Long resourceId) {
		super(String.format(ConstantUtility.RESOURCE_NOT_FOUND, resourceName, resourceId));
		this.resourceName = resourceName;
		this.resourceId = resourceId;
	}

	public static ResourceNotFoundException subscription(Long subscriptionId) {
		return new ResourceNotFoundException(ConstantUtility.SUBSCRIPTION, subscriptionId);
	}
}
