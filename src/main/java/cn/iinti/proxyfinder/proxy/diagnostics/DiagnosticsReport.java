package cn.iinti.proxyfinder.proxy.diagnostics;

import com.google.common.collect.ImmutableList;
import lombok.Getter;

import java.util.List;

@Getter
public class DiagnosticsReport {
    private final long timestamp;
    private final List<EndpointStatus> connectivity;
    private final List<EndpointStatus> echoEndpoints;

    public DiagnosticsReport(long timestamp, List<EndpointStatus> connectivity, List<EndpointStatus> echoEndpoints) {
        this.timestamp = timestamp;
        this.connectivity = ImmutableList.copyOf(connectivity);
        this.echoEndpoints = ImmutableList.copyOf(echoEndpoints);
    }

    public boolean isConnectionWorking() {
        return connectivity.stream().anyMatch(EndpointStatus::isWorking);
    }

    public int getWorkingCount() {
        return (int) echoEndpoints.stream().filter(EndpointStatus::isWorking).count();
    }

    public int getTotalCount() {
        return echoEndpoints.size();
    }

    public String summary() {
        return "internet: " + (isConnectionWorking() ? "UP" : "DOWN")
                + ", endpoints: " + getWorkingCount() + "/" + getTotalCount() + " working";
    }

    @Override
    public String toString() {
        return summary();
    }
}
