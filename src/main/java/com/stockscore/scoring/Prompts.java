package com.stockscore.scoring;

import com.stockscore.ai.PromptMessage;
import com.stockscore.model.Quote;

import java.util.List;
import java.util.Locale;

public final class Prompts {
    private Prompts() {}

    static final String SYSTEM_PROMPT = "You are a professional equity analyst who rates stocks with a fixed quantitative rubric.\n"
            + "Reply with exactly one JSON object. No markdown, no code fences, no text before or after the object.";

    static final String RUBRIC = "Scoring rubric (each dimension 0-10, one decimal):\n"
            + "- fundamental (weight 40%): valuation, profitability, balance sheet quality.\n"
            + "- technical (weight 30%): price trend, intraday range, momentum, volume.\n"
            + "- growth (weight 15%): revenue and earnings growth outlook.\n"
            + "- sentiment (weight 10%): market mood and news flow.\n"
            + "- industry_risk (weight 5%): sector headwinds; higher means lower risk.\n"
            + "overall = fundamental*0.4 + technical*0.3 + growth*0.15 + sentiment*0.1 + industry_risk*0.05\n"
            + "Ratings by overall: >=9.0 StrongBuy/green, >=7.5 Buy/yellow, >=6.0 Hold/orange, >=4.0 Reduce/red, <4.0 Sell/black.\n"
            + "When data is limited, infer from price action and volume rather than leaving a field out.";

    static final String OUTPUT_KEYS = "Required JSON keys:\n"
            + "{\"code\": string, \"name\": string, \"price\": number, \"change_pct\": number,\n"
            + " \"technical_score\": number, \"fundamental_score\": number, \"growth_score\": number,\n"
            + " \"sentiment_score\": number, \"industry_risk_score\": number,\n"
            + " \"rating\": string, \"signal\": string, \"reason\": string,\n"
            + " \"risks\": [string], \"opportunities\": [string], \"suggestion\": string}";

    public static List<PromptMessage> buildMessages(String entityId, Quote quote) {
        return List.of(
                PromptMessage.system(SYSTEM_PROMPT),
                PromptMessage.user(buildUserPrompt(entityId, quote))
        );
    }

    static String buildUserPrompt(String entityId, Quote quote) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("# Task\n");
        sb.append("Rate the stock below.\n\n");
        sb.append("## Stock\n");
        sb.append("Code: ").append(safe(entityId)).append("\n");
        if (quote != null && !quote.name.isEmpty()) {
            sb.append("Name: ").append(safe(quote.name)).append("\n");
        }
        sb.append("\n## Quote\n");
        sb.append(condensedQuote(quote));
        sb.append("\n## Rubric\n");
        sb.append(RUBRIC).append("\n\n");
        sb.append(OUTPUT_KEYS).append("\n");
        return sb.toString();
    }

    static String condensedQuote(Quote q) {
        if (q == null) {
            return "(no quote)\n";
        }
        StringBuilder sb = new StringBuilder(256);
        line(sb, "Last", q.lastDone);
        line(sb, "Open", q.open);
        line(sb, "High", q.high);
        line(sb, "Low", q.low);
        line(sb, "Prev close", q.prevClose);
        if (q.changePct != null) {
            sb.append("Change: ").append(String.format(Locale.US, "%+.2f%%", q.changePct)).append("\n");
        }
        if (q.volume != null) {
            sb.append("Volume: ").append(q.volume).append("\n");
        }
        line(sb, "Turnover", q.turnover);
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, Double value) {
        if (value == null) {
            return;
        }
        sb.append(label).append(": ").append(String.format(Locale.US, "%.4f", value)).append("\n");
    }

    private static String safe(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r", " ")
                .replace("\n", " ")
                .trim();
    }
}
