package io.chimera.core.provider;

enum DispatchState {
    NOT_STARTED,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED;

    boolean canMoveTo(DispatchState next) {
        return switch (this) {
            case NOT_STARTED -> next == IN_FLIGHT || next == FAILED;
            case IN_FLIGHT -> next == SUCCEEDED || next == FAILED;
            case SUCCEEDED, FAILED -> false;
        };
    }
}
