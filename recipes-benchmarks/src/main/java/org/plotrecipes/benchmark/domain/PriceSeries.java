package org.plotrecipes.benchmark.domain;

import java.util.List;

public class PriceSeries {

    private String ticker;
    private List<Double> closes;
    private List<Double> volumes;
    private boolean adjusted;

    public String getTicker() {
        return ticker;
    }

    public void setTicker(String ticker) {
        this.ticker = ticker;
    }

    public List<Double> getCloses() {
        return closes;
    }

    public void setCloses(List<Double> closes) {
        this.closes = closes;
    }

    public List<Double> getVolumes() {
        return volumes;
    }

    public void setVolumes(List<Double> volumes) {
        this.volumes = volumes;
    }

    public boolean isAdjusted() {
        return adjusted;
    }

    public void setAdjusted(boolean adjusted) {
        this.adjusted = adjusted;
    }
}
