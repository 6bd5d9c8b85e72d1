package nl.bytesoflife.proteintea.sustainability;

/**
 * One weighted component of the sustainability score.
 *
 * @param component which component
 * @param value     measured value
 * @param target    benchmark value
 * @param weight    weight in the overall score
 * @param score     {@code value / target × weight × 100}
 */
public record SubScore(ScoreComponent component, double value, double target, double weight, double score) {

    public static SubScore of(ScoreComponent component, double value, ScoreTarget target) {
        double score = value / target.target() * target.weight() * 100;
        return new SubScore(component, value, target.target(), target.weight(), score);
    }
}
