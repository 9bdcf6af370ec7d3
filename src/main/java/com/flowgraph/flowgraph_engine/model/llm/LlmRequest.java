package com.flowgraph.flowgraph_engine.model.llm;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Provider-agnostic request that LlmNode builds.
 * Each LlmClient implementation translates this into its provider's API format.
 */
public class LlmRequest {

    private String prompt;
    private String systemPrompt;
    private String model;
    private int maxTokens = 1000;
    private double temperature = 0.0;
    private List<ToolSpec> tools = new ArrayList<>();
    private Duration timeout;     // hint: time left in the run, null when unbounded

    public LlmRequest() {}

    public LlmRequest(String prompt, String model) {
        this.prompt = prompt;
        this.model = model;
    }

    public String getPrompt()         { return prompt; }
    public String getSystemPrompt()   { return systemPrompt; }
    public String getModel()          { return model; }
    public int getMaxTokens()         { return maxTokens; }
    public double getTemperature()    { return temperature; }
    public List<ToolSpec> getTools()  { return tools; }
    public Duration getTimeout()      { return timeout; }

    public boolean hasTools()         { return tools != null && !tools.isEmpty(); }

    public void setPrompt(String s)             { this.prompt = s; }
    public void setSystemPrompt(String s)       { this.systemPrompt = s; }
    public void setModel(String m)              { this.model = m; }
    public void setMaxTokens(int n)             { this.maxTokens = n; }
    public void setTemperature(double t)        { this.temperature = t; }
    public void setTools(List<ToolSpec> tools)  { this.tools = tools != null ? tools : new ArrayList<>(); }
    public void setTimeout(Duration timeout)    { this.timeout = timeout; }
}
