package com.flowgraph.flowgraph_engine.model.llm;

/**
 * Provider-agnostic response returned by every LlmClient.
 * An unsuccessful response aborts the run the same way a thrown client error does.
 */
public class LlmResponse {

    private boolean success;
    private String  text;          // exact text the model returned
    private String  errorMessage;  // populated if success = false
    private int     inputTokens;
    private int     outputTokens;
    private String  model;         // actual model used (provider may differ from requested)

    public LlmResponse() {}

    public static LlmResponse ok(String text, String model, int in, int out) {
        LlmResponse r = new LlmResponse();
        r.success      = true;
        r.text         = text;
        r.model        = model;
        r.inputTokens  = in;
        r.outputTokens = out;
        return r;
    }

    public static LlmResponse ok(String text, String model) {
        return ok(text, model, 0, 0);
    }

    public static LlmResponse error(String message) {
        LlmResponse r = new LlmResponse();
        r.success      = false;
        r.errorMessage = message;
        return r;
    }

    // ── Getters + Setters ──────────────────────────────────────────────────

    public boolean isSuccess()           { return success; }
    public String getText()              { return text; }
    public String getErrorMessage()      { return errorMessage; }
    public int getInputTokens()          { return inputTokens; }
    public int getOutputTokens()         { return outputTokens; }
    public String getModel()             { return model; }

    public void setSuccess(boolean b)    { this.success = b; }
    public void setText(String s)        { this.text = s; }
    public void setErrorMessage(String s){ this.errorMessage = s; }
    public void setInputTokens(int n)    { this.inputTokens = n; }
    public void setOutputTokens(int n)   { this.outputTokens = n; }
    public void setModel(String m)       { this.model = m; }
}
