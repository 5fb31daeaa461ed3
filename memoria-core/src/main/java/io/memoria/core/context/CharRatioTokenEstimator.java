package io.memoria.core.context;

public final class CharRatioTokenEstimator implements TokenEstimator {
    private final int charsPerToken;

    public CharRatioTokenEstimator() {
        this(4);
    }

    public CharRatioTokenEstimator(int charsPerToken) {
        if (charsPerToken < 1) {
            throw new IllegalArgumentException("charsPerToken must be positive");
        }
        this.charsPerToken = charsPerToken;
    }

    @Override
    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + charsPerToken - 1) / charsPerToken;
    }
}
