package com.signalfusion.common.economic;

import com.signalfusion.common.model.SignalResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores the macro backdrop from five economic indicators.
 *
 * <p>Risk points per indicator (all bounds strict):
 * <pre>
 *   VIX                 &gt; 30 → 3    &gt; 25 → 2    &gt; 20 → 1
 *   inflation %         &gt; 5  → 2    &gt; 3  → 1
 *   unemployment %      &gt; 6  → 2    &gt; 4  → 1
 *   fed funds rate %    &gt; 6  → 2    &gt; 4  → 1
 *   consumer sentiment  &lt; 70 → 2    &lt; 85 → 1
 * </pre>
 * The sum maps to a {@link MarketCondition}: &ge; 6 high risk, &ge; 4 moderate, &ge; 2 low,
 * otherwise risk-on.
 *
 * <p>Missing indicators are scored at {@link EconomicIndicators#DEFAULTS}. The result is
 * {@code DEGRADED} when any was missing and {@code UNAVAILABLE} when all were.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class EconomicContextAssessor {

    public SignalResult<EconomicRisk> assess(EconomicIndicators observed) {
        EconomicIndicators source = observed != null ? observed : EconomicIndicators.none();
        List<String> defaulted = source.missing();
        EconomicIndicators values = source.resolved();

        List<String> details = new ArrayList<>();
        int score = 0;

        // ── volatility ─────────────────────────────────────────────────────
        double vix = values.vix();
        if (vix > 30.0) {
            score += 3;
            details.add("High market volatility (VIX: " + format(vix) + ")");
        } else if (vix > 25.0) {
            score += 2;
            details.add("Elevated market volatility (VIX: " + format(vix) + ")");
        } else if (vix > 20.0) {
            score += 1;
            details.add("Moderate market volatility (VIX: " + format(vix) + ")");
        }

        // ── macro levels ───────────────────────────────────────────────────
        score += upper(values.inflation(), 5.0, 3.0, "High inflation concern", "Moderate inflation", details);
        score += upper(values.unemployment(), 6.0, 4.0, "High unemployment", "Elevated unemployment", details);
        score += upper(values.fedFundsRate(), 6.0, 4.0, "High interest rates", "Elevated interest rates", details);

        double sentiment = values.consumerSentiment();
        if (sentiment < 70.0) {
            score += 2;
            details.add("Poor consumer sentiment (" + format(sentiment) + ")");
        } else if (sentiment < 85.0) {
            score += 1;
            details.add("Weak consumer sentiment (" + format(sentiment) + ")");
        }

        EconomicRisk risk = new EconomicRisk(MarketCondition.forRiskScore(score), score, details, values, defaulted);
        if (defaulted.isEmpty()) {
            return SignalResult.ok(risk);
        }
        if (defaulted.size() == EconomicIndicators.COUNT) {
            return SignalResult.unavailable(risk, "no economic indicators available; scored at defaults");
        }
        return SignalResult.degraded(risk, "scored at default: " + String.join(", ", defaulted));
    }

    /** Two-band percentage indicator: 2 points above {@code high}, 1 above {@code elevated}. */
    private static int upper(double percent, double high, double elevated,
                             String highText, String elevatedText, List<String> details) {
        if (percent > high) {
            details.add(highText + " (" + format(percent) + "%)");
            return 2;
        }
        if (percent > elevated) {
            details.add(elevatedText + " (" + format(percent) + "%)");
            return 1;
        }
        return 0;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
