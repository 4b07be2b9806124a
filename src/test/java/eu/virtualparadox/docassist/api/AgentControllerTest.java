package eu.virtualparadox.docassist.api;

import eu.virtualparadox.docassist.agent.loop.AgentOutputParser;
import eu.virtualparadox.docassist.agent.loop.ResearchAgent;
import eu.virtualparadox.docassist.agent.tool.DateTimeTool;
import eu.virtualparadox.docassist.agent.tool.TextAnalyzerTool;
import eu.virtualparadox.docassist.agent.tool.ToolRegistry;
import eu.virtualparadox.docassist.agent.tool.calc.CalculatorTool;
import eu.virtualparadox.docassist.application.config.ApplicationConfig;
import eu.virtualparadox.docassist.rag.index.InMemoryVectorIndex;
import eu.virtualparadox.docassist.session.SessionRegistry;
import eu.virtualparadox.docassist.support.ScriptedGenerationGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AgentControllerTest {

    private final ScriptedGenerationGateway generation = new ScriptedGenerationGateway();
    private SessionRegistry registry;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ToolRegistry tools = new ToolRegistry(new CalculatorTool(), new TextAnalyzerTool(), new DateTimeTool());
        ResearchAgent agent = new ResearchAgent(tools, generation, new AgentOutputParser(), new ApplicationConfig());
        registry = new SessionRegistry(InMemoryVectorIndex::new);

        mvc = MockMvcBuilders.standaloneSetup(new AgentController(registry, agent))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void listsTools() throws Exception {
        mvc.perform(get("/api/agent/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].name").value("calculator"))
                .andExpect(jsonPath("$[2].name").value("datetime_tool"));
    }

    @Test
    void researchReturnsTheTrace() throws Exception {
        String id = registry.create().id();
        generation.reply("Action: calculator\nAction Input: 2+2", "AI: It is 4.");

        mvc.perform(post("/api/agent/{id}/research", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"What is 2+2?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.response").value("It is 4."))
                .andExpect(jsonPath("$.toolsUsed", hasSize(3)))
                .andExpect(jsonPath("$.steps[0].observation").value("The result of 2+2 is: 4"));
    }

    @Test
    void gatewayFailureIsReportedInTheBody() throws Exception {
        String id = registry.create().id();
        generation.failing();

        mvc.perform(post("/api/agent/{id}/research", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"Anything\",\"maxIterations\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("model endpoint unreachable"));
    }

    @Test
    void rejectsInvalidIterationCaps() throws Exception {
        String id = registry.create().id();

        mvc.perform(post("/api/agent/{id}/research", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"q\",\"maxIterations\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.maxIterations").exists());
    }

    @Test
    void clearsMemory() throws Exception {
        String id = registry.create().id();
        generation.reply("AI: hi");
        mvc.perform(post("/api/agent/{id}/research", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"hello\"}"));

        mvc.perform(delete("/api/agent/{id}/memory", id)).andExpect(status().isNoContent());

        assertThat(registry.get(id).agent().getMemory().isEmpty()).isTrue();
    }
}
