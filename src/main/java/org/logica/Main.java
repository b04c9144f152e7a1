package org.logica;

import org.logica.modules.Algorithm;
import org.logica.modules.CalculationRequest;
import org.logica.modules.CalculationResult;
import org.logica.modules.PolarityResult;
import org.logica.modules.SubformulaResult;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * MOTORE FORMULE PROPOSIZIONALI - Interfaccia a riga di comando
 *
 * PIPELINE:
 * 1. INPUT: formula in linea (-e) o letta da file (-f)
 * 2. SELEZIONE: analisi indicata dalla chiave del modulo (-m)
 * 3. CALCOLO: una singola invocazione del calcolatore con i parametri richiesti
 * 4. OUTPUT: resoconto testuale del risultato
 *
 * MODULI DISPONIBILI:
 * - truth-table, satisfiability, subformula, unit-propagation, interpretation,
 *   polarity, cnf-determinism, pure-atom, general-determinism, tseytin
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     */
    private static final String HELP_PARAM = "-h";
    private static final String MODULE_PARAM = "-m";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String POSITION_PARAM = "-p";
    private static final String INTERPRETATION_PARAM = "-i";
    private static final String STATEMENT_PARAM = "-s";
    private static final String TYPE_PARAM = "-t";
    private static final String LATEX_PARAM = "-latex";

    /** Configurazione del logging caricata dal classpath */
    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            CliConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            String formula = config.formulaFile() != null
                    ? readFormulaFromFile(config.formulaFile())
                    : config.formula();

            System.out.println("[I] Modulo: " + config.algorithm().title());
            CalculationResult result = execute(config, formula);
            System.out.println(render(result, config.latex()));

        } catch (Exception e) {
            handleGlobalError(e);
        }
    }

    /**
     * Esegue l'analisi selezionata sulla formula.
     */
    static CalculationResult execute(CliConfiguration config, String formula) {
        CalculationRequest request = new CalculationRequest(
                formula, config.position(), config.interpretation(), config.statement(), config.type());
        return config.algorithm().newCalculator().calculate(request);
    }

    /**
     * Resoconto testuale; con -latex la sottoformula è resa in LaTeX dove disponibile.
     */
    static String render(CalculationResult result, boolean latex) {
        String text = result.toDisplayString();
        if (!latex) {
            return text;
        }
        if (result instanceof SubformulaResult subformula) {
            return text + "\nLaTeX: " + subformula.latex();
        }
        if (result instanceof PolarityResult polarity) {
            return text + "\nLaTeX: " + polarity.subformulaLatex();
        }
        System.out.println("[W] Rendering LaTeX non disponibile per il modulo " + result.algorithm().key());
        return text;
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Esecuzione interrotta", e);
        System.out.println("[E] " + e.getMessage());
        System.exit(1);
    }

    private static void configureLogging() {
        try (InputStream input = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (input != null) {
                LogManager.getLogManager().readConfiguration(input);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    private static String readFormulaFromFile(String filePath) throws IOException {
        String content = Files.readString(Path.of(filePath)).trim();
        System.out.println("[I] Formula letta: " + content);
        return content;
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @return configurazione validata o null se help/errore
     */
    private static CliConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> MOTORE FORMULE PROPOSIZIONALI <<::");
        System.out.println("Analisi e trasformazioni di formule della logica proposizionale\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar motore-formule.jar -m <modulo> (-e <formula> | -f <file>) [opzioni]\n");

        System.out.println("PARAMETRI:");
        System.out.println("  -m <modulo>          Analisi da eseguire (vedi elenco)");
        System.out.println("  -e <formula>         Formula in linea");
        System.out.println("  -f <file>            File contenente la formula");
        System.out.println("  -p <posizione>       Posizione puntata, es. 1.2 (subformula, polarity)");
        System.out.println("  -i <asserzione>      Asserzione I⊨l oppure I⊭l (interpretation)");
        System.out.println("  -s <enunciato>       Enunciato I⊨expr oppure I⊭expr, A = formula semplificata");
        System.out.println("  -t cnf|general       Variante del controllo di determinismo");
        System.out.println("  -latex               Sottoformula anche in LaTeX (subformula, polarity)");
        System.out.println("  -h                   Mostra questa guida\n");

        System.out.println("MODULI:");
        for (Algorithm algorithm : Algorithm.values()) {
            System.out.printf("  %-22s %s%n", algorithm.key(), algorithm.title());
        }

        System.out.println("\nSINTASSI FORMULE:");
        System.out.println("  Variabili: lettere minuscole a-z");
        System.out.println("  Connettivi: ¬ ∧ ∨ → ↔   Costanti: ⊤ ⊥   Parentesi: ( )");
        System.out.println("  Formule CNF (unit-propagation, determinismo): (a∨¬b)∧(c)∧...\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar motore-formule.jar -m truth-table -e \"a→a\"");
        System.out.println("  java -jar motore-formule.jar -m polarity -e \"¬(a→b)\" -p 1.1");
        System.out.println("  java -jar motore-formule.jar -m interpretation -e \"a∧b\" -i \"I⊨¬a\" -s \"I⊭A\"\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    record CliConfiguration(Algorithm algorithm,
                            String formula,
                            String formulaFile,
                            String position,
                            String interpretation,
                            String statement,
                            String type,
                            boolean latex) {
    }

    /**
     * Parser dei parametri linea di comando.
     */
    static class ArgumentParser {

        /**
         * @param args parametri da linea comando
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri mancanti, ripetuti o sconosciuti
         */
        CliConfiguration parse(String[] args) {
            Algorithm algorithm = null;
            String formula = null;
            String formulaFile = null;
            String position = null;
            String interpretation = null;
            String statement = null;
            String type = null;
            boolean latex = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case MODULE_PARAM -> algorithm = Algorithm.fromKey(getNextArgument(args, ++i, "chiave modulo"));
                    case EXPRESSION_PARAM -> {
                        validateExclusiveInput(formulaFile);
                        formula = getNextArgument(args, ++i, "formula");
                    }
                    case FILE_PARAM -> {
                        validateExclusiveInput(formula);
                        formulaFile = getNextArgument(args, ++i, "file");
                        validateFileExists(formulaFile);
                    }
                    case POSITION_PARAM -> position = getNextArgument(args, ++i, "posizione");
                    case INTERPRETATION_PARAM -> interpretation = getNextArgument(args, ++i, "asserzione");
                    case STATEMENT_PARAM -> statement = getNextArgument(args, ++i, "enunciato");
                    case TYPE_PARAM -> type = getNextArgument(args, ++i, "tipo");
                    case LATEX_PARAM -> latex = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (algorithm == null) {
                throw new IllegalArgumentException("Specificare il modulo con -m");
            }
            if (formula == null && formulaFile == null) {
                throw new IllegalArgumentException("Specificare la formula con -e (in linea) o -f (file)");
            }
            if (algorithm == Algorithm.INTERPRETATION && (interpretation == null || statement == null)) {
                throw new IllegalArgumentException("Il modulo interpretation richiede -i e -s");
            }

            return new CliConfiguration(algorithm, formula, formulaFile, position, interpretation, statement,
                    type, latex);
        }

        private void validateExclusiveInput(String otherInput) {
            if (otherInput != null) {
                throw new IllegalArgumentException("Formula in linea (-e) e file (-f) sono mutualmente esclusivi");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }
    }

    //endregion
}
