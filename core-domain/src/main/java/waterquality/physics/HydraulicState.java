package waterquality.physics;

import lombok.Builder;
import waterquality.expression.HydraulicVariable;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Valores hidráulicos de un elemento en un paso de tiempo, tal como los entrega el
 * motor hidráulico. Cada campo corresponde a una {@link HydraulicVariable}.
 *
 * @param diameter       D, diámetro de la tubería.
 * @param roughness      Kc, coeficiente de rugosidad.
 * @param flow           Q, caudal.
 * @param velocity       U, velocidad media.
 * @param reynolds       Re, número de Reynolds.
 * @param shearVelocity  Us, velocidad de corte.
 * @param frictionFactor Ff, factor de fricción de Darcy-Weisbach.
 * @param areaPerVolume  Av, superficie por unidad de volumen.
 * @param length         Len, longitud de la tubería.
 */
@Builder
public record HydraulicState(double diameter, double roughness, double flow, double velocity, double reynolds,
                             double shearVelocity, double frictionFactor, double areaPerVolume, double length) {

    public double get(HydraulicVariable variable) {
        return switch (variable) {
            case DIAMETER -> diameter;
            case ROUGHNESS -> roughness;
            case FLOW -> flow;
            case VELOCITY -> velocity;
            case REYNOLDS -> reynolds;
            case SHEAR_VELOCITY -> shearVelocity;
            case FRICTION_FACTOR -> frictionFactor;
            case AREA_PER_VOLUME -> areaPerVolume;
            case LENGTH -> length;
        };
    }

    /**
     * Valores indexados por el símbolo usado en las expresiones (D, Kc, Q...).
     */
    public Map<String, Double> toBindings() {
        Map<String, Double> bindings = new LinkedHashMap<>();
        for (HydraulicVariable variable : HydraulicVariable.values()) {
            bindings.put(variable.getSymbol(), get(variable));
        }
        return bindings;
    }

    public Map<HydraulicVariable, Double> toMap() {
        Map<HydraulicVariable, Double> values = new EnumMap<>(HydraulicVariable.class);
        for (HydraulicVariable variable : HydraulicVariable.values()) {
            values.put(variable, get(variable));
        }
        return values;
    }
}
