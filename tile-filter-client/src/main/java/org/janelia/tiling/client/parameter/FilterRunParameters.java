package org.janelia.tiling.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.tiling.engine.RunParameters;
import org.janelia.tiling.filter.FilterFactory;
import org.janelia.tiling.filter.FilterSpec;
import org.janelia.tiling.filter.GaussianBlurFilter;
import org.janelia.tiling.transport.TransportKind;

/**
 * Parameters for configuring a tiled filter run.
 * Explicitly specified options override values loaded from a run parameters JSON file.
 */
public class FilterRunParameters implements Serializable {

    @Parameter(
            names = "--runParametersJson",
            description = "JSON file with run parameters (tileCount, filterSpec, transportKind)")
    public String runParametersJson;

    @Parameter(
            names = "--tileCount",
            description = "Number of horizontal tiles, each tile is filtered by its own worker (default: 2)")
    public Integer tileCount;

    @Parameter(
            names = "--filter",
            description = "Filter name (gaussian, rank, invert, identity) or fully qualified filter class name " +
                          "(default: gaussian)")
    public String filter;

    @Parameter(
            names = "--sigma",
            description = "Shortcut for --filterParameter sigma=<value> (gaussian filter only, default: 2.0)")
    public Double sigma;

    @Parameter(
            names = "--filterParameter",
            description = "Filter parameter formatted as name=value, repeat option for multiple parameters")
    public List<String> filterParameters = new ArrayList<>();

    @Parameter(
            names = "--transport",
            description = "How workers return filtered tiles: CHANNEL or SHARED_ARENA (default: CHANNEL)")
    public TransportKind transport;

    /**
     * @return run parameters derived from the JSON file (if specified) and the explicit options.
     *
     * @throws IOException
     *   if the JSON file cannot be read.
     *
     * @throws IllegalArgumentException
     *   if any parameter is invalid.
     */
    public RunParameters toRunParameters()
            throws IOException, IllegalArgumentException {

        RunParameters base = RunParameters.fromJson("{}");
        if (runParametersJson != null) {
            try (final Reader reader = new FileReader(runParametersJson)) {
                base = RunParameters.fromJson(reader);
            }
        }

        final FilterSpec filterSpec;
        if ((filter == null) && (sigma == null) && filterParameters.isEmpty()) {
            filterSpec = base.getFilterSpec();
        } else {
            final Map<String, String> parameterMap = new LinkedHashMap<>();
            if ((filter == null) && (base.getFilterSpec() != null)) {
                if (base.getFilterSpec().getParameters() != null) {
                    parameterMap.putAll(base.getFilterSpec().getParameters());
                }
            }
            if (sigma != null) {
                parameterMap.put(GaussianBlurFilter.SIGMA, String.valueOf(sigma));
            }
            for (final String nameValue : filterParameters) {
                final int separatorIndex = nameValue.indexOf('=');
                if (separatorIndex < 1) {
                    throw new IllegalArgumentException("filter parameter '" + nameValue +
                                                       "' must be formatted as name=value");
                }
                parameterMap.put(nameValue.substring(0, separatorIndex), nameValue.substring(separatorIndex + 1));
            }

            final String filterName;
            if (filter != null) {
                filterName = filter;
            } else if (base.getFilterSpec() != null) {
                filterName = base.getFilterSpec().getClassName();
            } else {
                filterName = FilterFactory.GAUSSIAN;
            }

            filterSpec = new FilterFactory().buildSpec(filterName, parameterMap);
        }

        final RunParameters runParameters =
                new RunParameters(tileCount == null ? base.getTileCount() : tileCount,
                                  filterSpec,
                                  transport == null ? base.getTransportKind() : transport);
        runParameters.validate();

        return runParameters;
    }

}
