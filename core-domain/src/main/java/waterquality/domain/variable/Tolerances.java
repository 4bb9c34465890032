package waterquality.domain.variable;

/**
 * Tolerancias absoluta y relativa del integrador para una especie concreta.
 */
public record Tolerances(double absolute, double relative) {
}
