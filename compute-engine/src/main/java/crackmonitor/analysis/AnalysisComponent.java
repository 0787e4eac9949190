package crackmonitor.analysis;

/**
 * Contrato base para cualquier componente algorítmico del análisis.
 * Permite tratar a todas las estrategias de forma polimórfica para tareas
 * de logging, identificación y depuración, sin importar lo que calculen.
 */
public interface AnalysisComponent {
    /**
     * Nombre corto del algoritmo (ej: "Trapezoidal", "Berrocal").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
