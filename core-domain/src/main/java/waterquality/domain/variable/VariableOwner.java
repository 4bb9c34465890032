package waterquality.domain.variable;

/**
 * Receptor de avisos de cambio de las variables. Lo implementa el modelo que las
 * contiene; la variable solo guarda una referencia débil a él.
 */
public interface VariableOwner {

    /**
     * La definición de la variable ha cambiado de forma que puede afectar a las
     * expresiones ya compiladas.
     */
    void variableChanged(ReactionVariable variable);
}
