package tw.gc.strategy.simulator.strategy;

/**
 * Side of a trade, with its sign.
 */
public enum TradeSide {
    BUY(1),
    SELL(-1);

    private final int sign;

    TradeSide(int sign) {
        this.sign = sign;
    }

    public int getSign() {
        return sign;
    }

    public TradeSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * -1 maps to {@link #SELL}, anything else to {@link #BUY}.
     */
    public static TradeSide fromSign(double sign) {
        return sign == -1 ? SELL : BUY;
    }
}
