package crackmonitor.profile;

/**
 * Etapas del cálculo de un {@link StrainProfile}, en orden de avance.
 */
public enum ProfileState {
    /**
     * Sin fisuras ni correcciones calculadas.
     */
    EMPTY,
    /**
     * Fisuras localizadas; sus límites son provisionales.
     */
    FOUND,
    /**
     * Longitudes de transferencia asignadas.
     */
    LENGTHS_ASSIGNED,
    /**
     * Correcciones de retracción y tension stiffening calculadas.
     */
    COMPENSATED,
    /**
     * Anchos calculados y escritos en cada fisura.
     */
    WIDTHS_COMPUTED;

    public boolean isAtLeast(ProfileState other) {
        return this.ordinal() >= other.ordinal();
    }
}
