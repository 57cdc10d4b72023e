package com.staycheckout.common.exception;

import com.staycheckout.common.result.ErrorKind;
import lombok.Getter;

/**
 * Business exception for domain rule violations that must abort a transaction.
 * Transactional code throws it to trigger rollback; callers translate it back into a
 * {@link com.staycheckout.common.result.Result} failure of the same {@link ErrorKind}.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final ErrorKind kind;

    public BusinessException(String message, ErrorKind kind) {
        super(message);
        this.kind = kind;
    }
}
