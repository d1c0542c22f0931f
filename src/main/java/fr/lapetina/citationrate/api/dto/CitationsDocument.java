package fr.lapetina.citationrate.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.citationrate.domain.model.PaperRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input document: yearly citation counts per paper for one profile, as captured
 * by the citation source.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CitationsDocument {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("scraped_at")
    private String scrapedAt;

    private List<Paper> papers = new ArrayList<>();

    // Getters and setters
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getScrapedAt() { return scrapedAt; }
    public void setScrapedAt(String scrapedAt) { this.scrapedAt = scrapedAt; }

    public List<Paper> getPapers() { return papers; }
    public void setPapers(List<Paper> papers) { this.papers = papers != null ? papers : new ArrayList<>(); }

    /**
     * Converts every paper entry to the domain record, preserving order.
     */
    public List<PaperRecord> toPaperRecords() {
        return papers.stream()
                .map(Paper::toPaperRecord)
                .toList();
    }

    /**
     * One paper entry. Counts are bound as raw JSON nodes so that a malformed count
     * fails only its own paper when the series is prepared, never the whole document.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Paper {
        private String title;

        @JsonProperty("total_citations")
        private JsonNode totalCitations;

        @JsonProperty("citations_by_year")
        private Map<String, JsonNode> citationsByYear;

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public JsonNode getTotalCitations() { return totalCitations; }
        public void setTotalCitations(JsonNode totalCitations) { this.totalCitations = totalCitations; }

        public Map<String, JsonNode> getCitationsByYear() { return citationsByYear; }
        public void setCitationsByYear(Map<String, JsonNode> citationsByYear) { this.citationsByYear = citationsByYear; }

        /**
         * Converts to domain PaperRecord. Validation happens when the series is prepared.
         */
        public PaperRecord toPaperRecord() {
            Map<String, Number> counts = null;
            if (citationsByYear != null) {
                counts = new LinkedHashMap<>();
                for (Map.Entry<String, JsonNode> entry : citationsByYear.entrySet()) {
                    counts.put(entry.getKey(), toNumber(entry.getValue()));
                }
            }
            return new PaperRecord(title, toNumber(totalCitations), counts);
        }

        /**
         * Numbers keep their JSON value, including fractions. Null stays null and any
         * other node becomes NaN, which validation rejects as an invalid count.
         */
        private static Number toNumber(JsonNode node) {
            if (node == null || node.isNull() || node.isMissingNode()) {
                return null;
            }
            if (node.isNumber()) {
                return node.numberValue();
            }
            return Double.NaN;
        }
    }
}
