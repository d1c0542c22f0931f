package fr.lapetina.citationrate.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.citationrate.domain.model.HyperparameterGridResult;
import fr.lapetina.citationrate.domain.model.SeriesFailure;
import fr.lapetina.citationrate.domain.model.TuningRun;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Output document of the tuning path.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TuningDocument {

    @JsonProperty("input_file")
    private String inputFile;

    @JsonProperty("n_papers")
    private int papers;

    @JsonProperty("n_papers_with_2plus_years")
    private int papersWithEnoughYears;

    @JsonProperty("min_count")
    private double minCount;

    @JsonProperty("n_grid")
    private int gridSize;

    private Optimal optimal;

    @JsonProperty("failed_series")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> failedSeries = new ArrayList<>();

    public static TuningDocument from(String inputFile, double minCount, TuningRun run) {
        HyperparameterGridResult result = run.gridResult();
        TuningDocument document = new TuningDocument();
        document.setInputFile(inputFile);
        document.setPapers(run.papersWithData());
        document.setPapersWithEnoughYears(result.getContributingSeries());
        document.setMinCount(minCount);
        document.setGridSize(result.getGridSize());

        Optimal optimal = new Optimal();
        optimal.setProcessVar(result.getBestProcessVariance());
        optimal.setOverdispersion(result.getBestOverdispersion());
        optimal.setLogLikelihood(result.getBestLogLikelihood());
        document.setOptimal(optimal);

        document.setFailedSeries(run.failures().stream()
                .map(SeriesFailure::seriesId)
                .collect(Collectors.toCollection(ArrayList::new)));
        return document;
    }

    // Getters and setters
    public String getInputFile() { return inputFile; }
    public void setInputFile(String inputFile) { this.inputFile = inputFile; }

    public int getPapers() { return papers; }
    public void setPapers(int papers) { this.papers = papers; }

    public int getPapersWithEnoughYears() { return papersWithEnoughYears; }
    public void setPapersWithEnoughYears(int papersWithEnoughYears) { this.papersWithEnoughYears = papersWithEnoughYears; }

    public double getMinCount() { return minCount; }
    public void setMinCount(double minCount) { this.minCount = minCount; }

    public int getGridSize() { return gridSize; }
    public void setGridSize(int gridSize) { this.gridSize = gridSize; }

    public Optimal getOptimal() { return optimal; }
    public void setOptimal(Optimal optimal) { this.optimal = optimal; }

    public List<String> getFailedSeries() { return failedSeries; }
    public void setFailedSeries(List<String> failedSeries) { this.failedSeries = failedSeries; }

    public static class Optimal {
        @JsonProperty("process_var")
        private double processVar;

        private double overdispersion;

        @JsonProperty("log_likelihood")
        private double logLikelihood;

        public double getProcessVar() { return processVar; }
        public void setProcessVar(double processVar) { this.processVar = processVar; }

        public double getOverdispersion() { return overdispersion; }
        public void setOverdispersion(double overdispersion) { this.overdispersion = overdispersion; }

        public double getLogLikelihood() { return logLikelihood; }
        public void setLogLikelihood(double logLikelihood) { this.logLikelihood = logLikelihood; }
    }
}
