package com.enterprise.channelnotification.client;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Objects;

/**
 * Outcome of a call against the notification service.
 * 
 * Either carries a value or a {@link ServiceError}; call sites switch on
 * {@link ServiceError.ErrorKind} instead of catching exceptions.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ServiceResult<T> {
    
    private final T value;
    private final ServiceError error;
    
    public static <T> ServiceResult<T> success(T value) {
        return new ServiceResult<>(value, null);
    }
    
    public static <T> ServiceResult<T> notFound(String message) {
        return new ServiceResult<>(null, new ServiceError(ServiceError.ErrorKind.NOT_FOUND, 404, message));
    }
    
    public static <T> ServiceResult<T> failure(Integer status, String message) {
        return new ServiceResult<>(null, new ServiceError(ServiceError.ErrorKind.OTHER, status, message));
    }
    
    public static <T> ServiceResult<T> failure(ServiceError error) {
        return new ServiceResult<>(null, Objects.requireNonNull(error));
    }
    
    public boolean isSuccess() {
        return error == null;
    }
    
    /**
     * Failure reported by the notification service or its transport.
     */
    @Getter
    @ToString
    @RequiredArgsConstructor
    public static class ServiceError {
        
        private final ErrorKind kind;
        
        /**
         * HTTP status when one was received, null for transport failures
         */
        private final Integer status;
        
        private final String message;
        
        public enum ErrorKind {
            NOT_FOUND,
            OTHER
        }
    }
}
