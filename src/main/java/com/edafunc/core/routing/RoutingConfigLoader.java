package com.edafunc.core.routing;

import com.edafunc.model.DestinationType;
import com.edafunc.model.OutputDestination;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a routing YAML file into a {@link RoutingTable}.
 *
 * Everything is validated up front (destination kinds, targets, filter
 * syntax) so a broken file is rejected as a whole instead of misrouting
 * events later.
 */
public class RoutingConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * @param path            the YAML file
     * @param currentDefault  default destination kept when the file has none
     */
    public RoutingTable load(Path path, OutputDestination currentDefault) throws RoutingConfigException {
        if (!Files.isRegularFile(path)) {
            throw new RoutingConfigException("Routing file not found: " + path);
        }

        RoutingConfigFile file;
        try {
            file = yamlMapper.readValue(path.toFile(), RoutingConfigFile.class);
        } catch (IOException e) {
            throw new RoutingConfigException("Cannot parse routing file " + path + ": " + e.getMessage(), e);
        }
        if (file == null || file.getRouting() == null) {
            throw new RoutingConfigException("Routing file " + path + " has no 'routing' section");
        }

        RoutingConfigFile.Routing routing = file.getRouting();
        OutputDestination defaultDestination = routing.getDefaultDestination() == null
                ? currentDefault
                : toDestination(routing.getDefaultDestination(), "default");

        List<RoutingRule> rules = new ArrayList<>();
        List<RoutingConfigFile.RuleSpec> specs = routing.getRules() == null ? List.of() : routing.getRules();
        for (int i = 0; i < specs.size(); i++) {
            RoutingConfigFile.RuleSpec spec = specs.get(i);
            String name = spec.getName() == null || spec.getName().isBlank() ? "rule-" + (i + 1) : spec.getName();
            if (spec.getDestination() == null) {
                throw new RoutingConfigException("Rule '" + name + "' has no destination");
            }
            Filter filter;
            try {
                filter = FilterCompiler.compile(spec.getFilter());
            } catch (FilterSyntaxException e) {
                throw new RoutingConfigException("Rule '" + name + "' has an invalid filter: " + e.getMessage(), e);
            }
            rules.add(new RoutingRule(name, filter, toDestination(spec.getDestination(), name)));
        }
        return new RoutingTable(defaultDestination, rules);
    }

    public static OutputDestination toDestination(RoutingConfigFile.DestinationSpec spec, String owner)
            throws RoutingConfigException {
        DestinationType type = DestinationType.fromName(spec.getType())
                .orElseThrow(() -> new RoutingConfigException(
                        "Destination of '" + owner + "' has unknown type: " + spec.getType()));
        if (type != DestinationType.DISCARD && (spec.getTarget() == null || spec.getTarget().isBlank())) {
            throw new RoutingConfigException("Destination of '" + owner + "' has no target");
        }
        return OutputDestination.of(type, spec.getTarget(), spec.getCluster());
    }
}
