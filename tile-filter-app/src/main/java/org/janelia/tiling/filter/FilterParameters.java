package org.janelia.tiling.filter;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable set of named filter parameters.
 * A single instance is shared, without synchronization, by every region of a run.
 */
public class FilterParameters
        implements Serializable {

    public static final FilterParameters EMPTY = new FilterParameters(Collections.emptyMap());

    private final Map<String, String> parameters;

    public FilterParameters(final Map<String, String> parameters) {
        this.parameters = parameters == null ?
                          Collections.emptyMap() :
                          Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * @return a copy of these parameters with the specified value added (or replaced).
     */
    public FilterParameters with(final String parameterName,
                                 final Object value) {
        final Map<String, String> map = new LinkedHashMap<>(parameters);
        map.put(parameterName, String.valueOf(value));
        return new FilterParameters(map);
    }

    public Map<String, String> asMap() {
        return parameters;
    }

    public boolean isDefined(final String parameterName) {
        return parameters.containsKey(parameterName);
    }

    public String getStringParameter(final String parameterName)
            throws IllegalArgumentException {
        final String valueString = parameters.get(parameterName);
        if (valueString == null) {
            throw new IllegalArgumentException("'" + parameterName + "' is not defined");
        }
        return valueString;
    }

    public Integer getIntegerParameter(final String parameterName)
            throws IllegalArgumentException {
        final String valueString = getStringParameter(parameterName);
        try {
            return Integer.parseInt(valueString);
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
    }

    public Integer getIntegerParameter(final String parameterName,
                                       final int defaultValue)
            throws IllegalArgumentException {
        return isDefined(parameterName) ? getIntegerParameter(parameterName) : defaultValue;
    }

    public Double getDoubleParameter(final String parameterName)
            throws IllegalArgumentException {
        final String valueString = getStringParameter(parameterName);
        try {
            return Double.parseDouble(valueString);
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
    }

    public Double getDoubleParameter(final String parameterName,
                                     final double defaultValue)
            throws IllegalArgumentException {
        return isDefined(parameterName) ? getDoubleParameter(parameterName) : defaultValue;
    }

    @Override
    public String toString() {
        return parameters.toString();
    }
}
