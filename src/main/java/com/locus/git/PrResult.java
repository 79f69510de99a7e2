package com.locus.git;

/**
 * Outcome of a pull request attempt. Exactly one of {@code url} and {@code error} is set.
 */
public record PrResult(String url, Integer number, String error) {

    public static PrResult created(String url, Integer number) {
        return new PrResult(url, number, null);
    }

    public static PrResult failed(String error) {
        return new PrResult(null, null, error);
    }

    public boolean isCreated() {
        return url != null;
    }
}
