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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maintains a mapping of short filter names to filter implementation classes and
 * facilitates constructing the corresponding specifications.
 */
public class FilterFactory {

    public static final String GAUSSIAN = "gaussian";
    public static final String RANK = "rank";
    public static final String INVERT = "invert";
    public static final String IDENTITY = "identity";

    private final Map<String, Class<? extends Filter>> namedFilterClasses;

    /**
     * Constructs a factory that knows the standard filters.
     */
    public FilterFactory() {
        this.namedFilterClasses = new LinkedHashMap<>();
        addFilter(GAUSSIAN, GaussianBlurFilter.class);
        addFilter(RANK, RankFilter.class);
        addFilter(INVERT, InvertFilter.class);
        addFilter(IDENTITY, IdentityFilter.class);
    }

    /**
     * Adds (or replaces) the named filter.
     *
     * @param  name         short name for the filter.
     * @param  filterClass  filter implementation.
     */
    public void addFilter(final String name,
                          final Class<? extends Filter> filterClass) {
        namedFilterClasses.put(name, filterClass);
    }

    public Map<String, Class<? extends Filter>> getNamedFilterClasses() {
        return Collections.unmodifiableMap(namedFilterClasses);
    }

    /**
     * @param  nameOrClassName  short name of a registered filter or a fully qualified filter class name.
     * @param  parameters       parameters for the filter.
     *
     * @return specification for the filter.
     *
     * @throws IllegalArgumentException
     *   if the name is not registered and does not look like a class name.
     */
    public FilterSpec buildSpec(final String nameOrClassName,
                                final Map<String, String> parameters)
            throws IllegalArgumentException {

        final Class<? extends Filter> filterClass = namedFilterClasses.get(nameOrClassName);

        final String className;
        if (filterClass != null) {
            className = filterClass.getName();
        } else if ((nameOrClassName != null) && nameOrClassName.contains(".")) {
            className = nameOrClassName;
        } else {
            throw new IllegalArgumentException("filter '" + nameOrClassName + "' not found, known filters are " +
                                               namedFilterClasses.keySet() +
                                               " (fully qualified class names are also supported)");
        }

        return new FilterSpec(className,
                              parameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parameters));
    }

}
