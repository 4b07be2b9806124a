package eu.virtualparadox.docassist.agent.tool;

public record ToolDescriptor(String name, String description) {

    public static ToolDescriptor of(final Tool tool) {
        return new ToolDescriptor(tool.name(), tool.description());
    }
}
