package com.richcorabbithole.pipeline.research;

/**
 * Instructions sent with every research request.
 */
public final class ResearchPrompt {

    public static final String SYSTEM = "You are a research assistant for a technical blog called richcorabbithole.\n"
            + "Your job is to produce comprehensive, well-sourced research on a given topic.\n"
            + "\n"
            + "Structure your research as markdown with:\n"
            + "- An executive summary (2-3 sentences)\n"
            + "- Key findings organized by theme\n"
            + "- Important data points, statistics, or quotes\n"
            + "- A list of recommended sources/references\n"
            + "- Suggested angles for a blog post\n"
            + "\n"
            + "Be thorough but concise. Focus on accuracy and cite specific sources where possible.";

    private ResearchPrompt() {
    }

    public static String userMessage(String topic) {
        return "Research the following topic thoroughly: " + topic;
    }
}
