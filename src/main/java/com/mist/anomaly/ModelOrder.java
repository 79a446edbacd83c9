package com.mist.anomaly;

/**
 * ARIMA(p, d, q) order plus whether an intercept is estimated on the differenced series.
 */
public final class ModelOrder {
    private final int p;
    private final int d;
    private final int q;
    private final boolean constant;

    private ModelOrder(int p, int d, int q, boolean constant) {
        this.p = p;
        this.d = d;
        this.q = q;
        this.constant = constant;
    }

    /**
     * Order with the conventional intercept rule: a constant only when the series is not differenced.
     */
    public static ModelOrder of(int p, int d, int q) throws InvalidConfigurationException {
        return of(p, d, q, d == 0);
    }

    public static ModelOrder of(int p, int d, int q, boolean constant) throws InvalidConfigurationException {
        if (p < 0 || d < 0 || q < 0)
            throw new InvalidConfigurationException("order components cannot be negative, got (" + p + "," + d + "," + q + ")");
        if (p == 0 && d == 0 && q == 0 && !constant)
            throw new InvalidConfigurationException("order (0,0,0) without a constant has nothing to model");
        return new ModelOrder(p, d, q, constant);
    }

    /**
     * Parse "p,d,q" as written in configuration files and on the command line.
     */
    public static ModelOrder parse(String text) throws InvalidConfigurationException {
        String[] parts = text == null ? new String[0] : text.replace("(", "").replace(")", "").split(",");
        if (parts.length != 3)
            throw new InvalidConfigurationException("order must be written as p,d,q, got '" + text + "'");
        try {
            return of(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()), Integer.parseInt(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("order must be written as p,d,q, got '" + text + "'", e);
        }
    }

    public int getP() {
        return p;
    }

    public int getD() {
        return d;
    }

    public int getQ() {
        return q;
    }

    public boolean hasConstant() {
        return constant;
    }

    /**
     * Points at the head of a series that cannot be predicted: p lags of the d-times differenced series.
     */
    public int burnIn() {
        return p + d;
    }

    /**
     * Number of regression coefficients (AR, MA and intercept).
     */
    public int coefficientCount() {
        return p + q + (constant ? 1 : 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelOrder)) return false;
        ModelOrder other = (ModelOrder) o;
        return p == other.p && d == other.d && q == other.q && constant == other.constant;
    }

    @Override
    public int hashCode() {
        return ((p * 31 + d) * 31 + q) * 2 + (constant ? 1 : 0);
    }

    @Override
    public String toString() {
        return "(" + p + "," + d + "," + q + ")" + (constant ? "+c" : "");
    }
}
