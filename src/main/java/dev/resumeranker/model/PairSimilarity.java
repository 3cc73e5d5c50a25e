package dev.resumeranker.model;

/**
 * One entry of the pairwise similarity matrix.
 *
 * @param firstId         submission id of the first resume
 * @param secondId        submission id of the second resume
 * @param content         shingle overlap of normalized text
 * @param contact         1 when email or canonical phone match, else 0
 * @param skills          Jaccard overlap of extracted skills
 * @param scoreProximity  1 - |composite difference|, informational
 * @param overall         similarity compared against the duplicate threshold
 * @param trigger         signal that produced {@code overall}
 */
public record PairSimilarity(
        String firstId,
        String secondId,
        double content,
        double contact,
        double skills,
        double scoreProximity,
        double overall,
        DuplicateCriterion trigger) {

    public boolean exceedsThreshold(double threshold) {
        return overall >= threshold;
    }
}
