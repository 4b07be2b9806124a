package eu.virtualparadox.docassist.agent.tool;

import eu.virtualparadox.docassist.agent.tool.calc.CalculatorTool;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed set of tools keyed by name, in registration order.
 * <p>
 * The model selects a tool by name at runtime; resolution is a plain map lookup, so the set of
 * capabilities stays closed and enumerable.
 */
@Component
public class ToolRegistry {

    private final Map<String, Tool> toolsByName = new LinkedHashMap<>();

    @Autowired
    public ToolRegistry(final CalculatorTool calculator,
                        final TextAnalyzerTool textAnalyzer,
                        final DateTimeTool dateTime) {
        this(List.of(calculator, textAnalyzer, dateTime));
    }

    ToolRegistry(final List<Tool> tools) {
        for (final Tool tool : tools) {
            if (toolsByName.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.name());
            }
        }
    }

    public static ToolRegistry of(final Tool... tools) {
        return new ToolRegistry(Arrays.asList(tools));
    }

    public Optional<Tool> get(final String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(toolsByName.get(name.trim()));
    }

    public List<Tool> tools() {
        return Collections.unmodifiableList(new ArrayList<>(toolsByName.values()));
    }

    public List<String> names() {
        return List.copyOf(toolsByName.keySet());
    }

    public List<ToolDescriptor> describe() {
        return toolsByName.values().stream().map(ToolDescriptor::of).toList();
    }
}
