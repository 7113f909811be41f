package org.fol;

import org.fol.clause.ClauseClassification;
import org.fol.pipeline.CNFPipeline;
import org.fol.pipeline.Derivation;
import org.fol.pipeline.DerivationReport;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * CONVERTITORE FNC - Formule del primo ordine in Forma Normale Congiuntiva
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Formula da linea di comando, da file di testo o da tutti i .txt di una directory
 * 2. PARSING: Notazione LaTeX -> albero sintattico (ANTLR) -> Formula
 * 3. TRASFORMAZIONI: implicazioni, De Morgan, α-ridenominazione, prenessa, Skolem, distribuzione
 * 4. ANALISI: forma clausale e verifica delle clausole di Horn
 * 5. OUTPUT: derivazione passo per passo a schermo e, se richiesto, in FNC/
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Formula diretta (-e): Elaborazione della formula passata come argomento
 * - File singolo (-f): Elaborazione della formula contenuta in un file
 * - Directory batch (-d): Elaborazione di tutti i file .txt di una cartella
 * - Output directory (-o): Salvataggio delle derivazioni in FNC/
 * - Log dettagliato (-v)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String VERBOSE_PARAM = "-v";

    private static final String INPUT_EXTENSION = ".txt";
    private static final String REPORT_EXTENSION = ".fnc.txt";
    private static final String REPORT_DIR = "FNC";
    private static final String LOGGING_CONFIG = "/logging.properties";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO CONVERTITORE FNC <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            ConverterConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            if (config.verbose) {
                enableVerboseLogging();
            }
            executeMainPipeline(config, new CNFPipeline());

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE CONVERTITORE FNC <---");
        }
    }

    /**
     * Sceglie la modalità operativa in base alla configurazione.
     */
    static void executeMainPipeline(ConverterConfiguration config, CNFPipeline pipeline) throws IOException {
        switch (config.mode) {
            case EXPRESSION -> {
                System.out.println("[I] Modalità: Formula diretta");
                processFormula(config.input, "formula", config, pipeline);
            }
            case FILE -> {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                processSingleFile(Paths.get(config.input), config, pipeline);
            }
            case DIRECTORY -> {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(config, pipeline);
            }
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.exit(1);
    }

    //endregion

    //region CONFIGURAZIONE LOGGING

    /**
     * Carica logging.properties dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("org.fol");
        root.setLevel(Level.FINE);

        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.addHandler(handler);
        root.setUseParentHandlers(false);
    }

    //endregion

    //region ELABORAZIONE FORMULE

    /**
     * Elabora una formula e ne mostra (ed eventualmente salva) la derivazione.
     *
     * @return true se la formula è stata convertita
     */
    static boolean processFormula(String formulaText, String baseName, ConverterConfiguration config,
                                  CNFPipeline pipeline) throws IOException {
        System.out.println("[I] Formula letta: " + formulaText);

        Derivation derivation = pipeline.run(formulaText);
        String report = DerivationReport.render(derivation);
        System.out.println(report);

        if (derivation.isFailed()) {
            System.out.println("[E] " + derivation.errorMessage());
        } else {
            displayHornSummary(derivation);
        }

        if (config.outputPath != null) {
            saveReport(report, baseName, config);
        }
        return !derivation.isFailed();
    }

    private static void displayHornSummary(Derivation derivation) {
        List<ClauseClassification> clauses = derivation.hornAnalysis().clauses();
        long hornCount = clauses.stream().filter(ClauseClassification::horn).count();

        System.out.println("[I] CNF: " + derivation.finalFormula());
        System.out.println("[I] Clausole: " + clauses.size() + " (Horn: " + hornCount + ")");
    }

    private static void processSingleFile(Path file, ConverterConfiguration config, CNFPipeline pipeline) throws IOException {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + file.getFileName());
        System.out.println("=========================\n");

        String content = Files.readString(file, StandardCharsets.UTF_8).trim();
        processFormula(content, getBaseFileName(file), config, pipeline);
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    /**
     * Elabora tutti i file .txt di una directory; un errore su un file non ferma gli altri.
     */
    private static void processDirectoryBatch(ConverterConfiguration config, CNFPipeline pipeline) throws IOException {
        System.out.println("[I] Inizio elaborazione directory: " + config.input);

        List<Path> files = findAllTxtFiles(config.input);
        if (files.isEmpty()) {
            System.out.println("[W] Nessun file .txt trovato nella directory specificata.");
            return;
        }

        int converted = 0;
        int failed = 0;
        for (Path file : files) {
            try {
                System.out.println("Elaborazione: " + file.getFileName());
                String content = Files.readString(file, StandardCharsets.UTF_8).trim();
                if (processFormula(content, getBaseFileName(file), config, pipeline)) {
                    converted++;
                } else {
                    failed++;
                }
            } catch (IOException e) {
                System.out.println("[E] Errore nel file " + file.getFileName() + ": " + e.getMessage());
                failed++;
            }
            System.out.println();
        }

        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File trovati: " + files.size());
        System.out.println("File convertiti: " + converted);
        System.out.println("File con errori: " + failed);
        System.out.println("=========================================\n");
    }

    private static List<Path> findAllTxtFiles(String dirPath) throws IOException {
        try (var paths = Files.list(Paths.get(dirPath))) {
            return paths
                    .filter(path -> path.toString().toLowerCase().endsWith(INPUT_EXTENSION))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }

    //endregion

    //region GESTIONE DELL'OUTPUT

    private static void saveReport(String report, String baseName, ConverterConfiguration config) throws IOException {
        Path outputDir = Paths.get(config.outputPath, REPORT_DIR);
        Files.createDirectories(outputDir);

        Path outputFile = outputDir.resolve(baseName + REPORT_EXTENSION);
        Files.writeString(outputFile, report, StandardCharsets.UTF_8);
        System.out.println("[I] Derivazione salvata: " + outputFile);
    }

    private static String getBaseFileName(Path file) {
        String fileName = file.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static ConverterConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void printApplicationHelp() {
        System.out.println("\n::>> CONVERTITORE FNC <<::");
        System.out.println("Conversione di formule del primo ordine in Forma Normale Congiuntiva\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar convertitore-fnc.jar [opzioni]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -e <formula>    Elabora la formula passata come argomento");
        System.out.println("  -f <file>       Elabora la formula contenuta in un file");
        System.out.println("  -d <directory>  Elabora tutti i file .txt in una directory");
        System.out.println("  -o <directory>  Salva le derivazioni in <directory>/FNC");
        System.out.println("  -v              Log dettagliato delle trasformazioni");
        System.out.println("  -h              Mostra questa guida\n");

        System.out.println("NOTAZIONE:");
        System.out.println("  \\rightarrow \\to  \\leftrightarrow \\iff  \\land \\wedge  \\lor \\vee  \\neg \\lnot");
        System.out.println("  \\forall x A   \\exists x A   P(x,f(y))\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar convertitore-fnc.jar -e \"\\forall x \\exists y P(x,y)\"");
        System.out.println("  java -jar convertitore-fnc.jar -d ./formule/ -o ./output/\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    enum InputMode {
        EXPRESSION,
        FILE,
        DIRECTORY
    }

    /**
     * Configurazione validata dell'applicazione.
     */
    static final class ConverterConfiguration {
        final InputMode mode;
        final String input;
        final String outputPath;
        final boolean verbose;

        ConverterConfiguration(InputMode mode, String input, String outputPath, boolean verbose) {
            this.mode = mode;
            this.input = input;
            this.outputPath = outputPath;
            this.verbose = verbose;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    static final class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        ConverterConfiguration parse(String[] args) {
            InputMode mode = null;
            String input = null;
            String outputPath = null;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case EXPRESSION_PARAM -> {
                        validateExclusiveMode(mode, InputMode.EXPRESSION);
                        input = getNextArgument(args, ++i, "formula");
                        mode = InputMode.EXPRESSION;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(mode, InputMode.FILE);
                        input = getNextArgument(args, ++i, "file");
                        validateFileExists(input);
                        mode = InputMode.FILE;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(mode, InputMode.DIRECTORY);
                        input = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(input);
                        mode = InputMode.DIRECTORY;
                    }
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case VERBOSE_PARAM -> verbose = true;
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare una formula (-e), un file (-f) o una directory (-d)");
            }
            return new ConverterConfiguration(mode, input, outputPath, verbose);
        }

        private void validateExclusiveMode(InputMode current, InputMode requested) {
            if (current != null) {
                throw new IllegalArgumentException("Modalità " + requested + " incompatibile con " + current);
            }
        }

        private String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per " + description);
            }
            return args[index];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.isFile() || !file.canRead()) {
                throw new IllegalArgumentException("File non esistente o non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.isDirectory() || !dir.canRead()) {
                throw new IllegalArgumentException("Directory non esistente o non leggibile: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists() && !dir.mkdirs()) {
                throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
            }
            if (!dir.isDirectory() || !dir.canWrite()) {
                throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
            }
        }
    }

    //endregion
}
