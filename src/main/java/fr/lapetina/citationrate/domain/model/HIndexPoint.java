package fr.lapetina.citationrate.domain.model;

/**
 * Projected h-index at the end of a calendar year.
 */
public record HIndexPoint(int year, int hIndex, boolean forecast) {
}
