package org.logica.cnf;

/**
 * Stato terminale della propagazione unitaria.
 */
public enum PropagationOutcome {
    /** Nessuna clausola residua: formula soddisfatta */
    EMPTY,
    /** Una clausola non unitaria è stata svuotata */
    CONTRADICTION,
    /** Nessuna clausola unitaria, ma restano clausole non vuote */
    STALLED
}
