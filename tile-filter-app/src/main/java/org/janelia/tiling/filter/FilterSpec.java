/*
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.tiling.filter;

import java.util.Map;

import org.janelia.tiling.json.JsonUtils;

/**
 * Specifies a {@link org.janelia.tiling.filter.Filter} implementation along with its parameters.
 */
public class FilterSpec {

    private final String className;
    private final Map<String, String> parameters;

    private transient Class<?> clazz;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FilterSpec() {
        this.className = null;
        this.parameters = null;
    }

    /**
     * Full constructor.
     *
     * @param  className   name of filter implementation (java) class.
     * @param  parameters  parameters passed to the filter for every region.
     */
    public FilterSpec(final String className,
                      final Map<String, String> parameters) {
        this.className = className;
        this.parameters = parameters;
    }

    public String getClassName() {
        return className;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    /**
     * @return immutable view of this specification's parameters.
     */
    public FilterParameters getFilterParameters() {
        return new FilterParameters(parameters);
    }

    /**
     * @return instance of this filter (with parameters already validated).
     *
     * @throws IllegalArgumentException
     *   if an instance cannot be created for any reason or if the parameters are invalid.
     */
    public Filter buildInstance()
            throws IllegalArgumentException {

        final Class<?> clazz = getClazz();
        final Object instance;
        try {
            instance = clazz.getDeclaredConstructor().newInstance();
        } catch (final Exception e) {
            throw new IllegalArgumentException("failed to create instance of filter class '" + className + "'", e);
        }

        final Filter filter;
        if (instance instanceof Filter) {
            filter = (Filter) instance;
        } else {
            throw new IllegalArgumentException("class '" + className + "' does not implement the '" +
                                               Filter.class + "' interface");
        }

        filter.validate(getFilterParameters());

        return filter;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    public static FilterSpec fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    /**
     * @param  filterClass  filter implementation.
     * @param  parameters   parameters for the filter.
     *
     * @return specification for the filter class and parameters.
     */
    public static FilterSpec forFilter(final Class<? extends Filter> filterClass,
                                       final FilterParameters parameters) {
        return new FilterSpec(filterClass.getName(), parameters.asMap());
    }

    private Class<?> getClazz() throws IllegalArgumentException {
        if (clazz == null) {
            if (className == null) {
                throw new IllegalArgumentException("no className defined for filter spec");
            }
            try {
                clazz = Class.forName(className);
            } catch (final ClassNotFoundException e) {
                throw new IllegalArgumentException("filter class '" + className + "' cannot be found", e);
            }
        }
        return clazz;
    }

    private static final JsonUtils.Helper<FilterSpec> JSON_HELPER =
            new JsonUtils.Helper<>(FilterSpec.class);
}
