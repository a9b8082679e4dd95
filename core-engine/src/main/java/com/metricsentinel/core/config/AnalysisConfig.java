package com.metricsentinel.core.config;

import com.metricsentinel.core.error.ConfigurationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the analysis YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * cost:
 *   sources: [ec2, lambda]
 *   lookbackDays: 30
 * logs:
 *   sources: [/aws/lambda/orders]
 *   lookbackHours: 24
 * </pre>
 *
 * <p>
 * Either section may be omitted, in which case its defaults apply and the
 * corresponding job has no sources. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private CostJobSettings cost = new CostJobSettings();
    private LogJobSettings logs = new LogJobSettings();

    /**
     * Validate both sections, collecting every problem before failing.
     *
     * @throws ConfigurationException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        cost.validate(errors);
        logs.validate(errors);

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Analysis configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public CostJobSettings getCost() {
        return cost;
    }

    public void setCost(CostJobSettings cost) {
        this.cost = cost != null ? cost : new CostJobSettings();
    }

    public LogJobSettings getLogs() {
        return logs;
    }

    public void setLogs(LogJobSettings logs) {
        this.logs = logs != null ? logs : new LogJobSettings();
    }

    @Override
    public String toString() {
        return "AnalysisConfig{cost=" + cost + ", logs=" + logs + '}';
    }
}
