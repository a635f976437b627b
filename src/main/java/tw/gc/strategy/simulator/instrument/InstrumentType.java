package tw.gc.strategy.simulator.instrument;

/**
 * Kind of tradable an {@link Instrument} represents.
 */
public enum InstrumentType {
    STOCK("stock"),
    FUTURE("future");

    private final String code;

    InstrumentType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parse from code string (e.g., "stock", "future"), case-insensitive.
     * Also accepts the enum name.
     */
    public static InstrumentType fromCode(String code) {
        if (code != null) {
            for (InstrumentType type : values()) {
                if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Type of instrument is not supported: " + code);
    }
}
