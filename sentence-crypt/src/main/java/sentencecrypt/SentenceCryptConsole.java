package sentencecrypt;

import sentencecrypt.config.SentenceCryptConfig;
import sentencecrypt.passphrase.GenerationParams;
import sentencecrypt.passphrase.WordList;
import sentencecrypt.strength.StrengthReport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Menu-driven front end over {@link SentenceCrypt}.
 *
 * Reads answers line by line from {@code in} and writes prompts and results to
 * {@code out}. End of input ends the session.
 */
public class SentenceCryptConsole {

    private final BufferedReader in;
    private final PrintStream out;
    private final SentenceCrypt crypt;
    private final WordList wordList;
    private final SentenceCryptConfig config;

    public SentenceCryptConsole(BufferedReader in, PrintStream out, SentenceCrypt crypt,
                                WordList wordList, SentenceCryptConfig config) {
        this.in = in;
        this.out = out;
        this.crypt = crypt;
        this.wordList = wordList;
        this.config = config;
    }

    public void run() throws IOException {
        while (true) {
            printMenu();
            String choice = prompt("Enter your choice (0/1/2): ");
            if (choice == null) {
                return;
            }
            switch (choice) {
                case "1" -> {
                    if (!handleEncrypt()) return;
                }
                case "2" -> {
                    if (!handleDecrypt()) return;
                }
                case "0" -> {
                    out.println("Goodbye!");
                    return;
                }
                default -> out.println("Invalid choice. Please enter 0, 1, or 2.\n");
            }
        }
    }

    private void printMenu() {
        out.println("=== " + crypt.profile().encryptor().algorithmName() + " Sentence Encryption Tool ===");
        out.println("  1) Encrypt a sentence");
        out.println("  2) Decrypt a sentence");
        out.println("  0) Exit");
    }

    /** @return false once input is exhausted */
    private boolean handleEncrypt() throws IOException {
        String plaintext = prompt("\nEnter the sentence you want to ENCRYPT:\n> ");
        if (plaintext == null) {
            return false;
        }
        if (plaintext.isEmpty()) {
            out.println("Nothing to encrypt (empty input).");
            return true;
        }

        String password = askForPasswordOrPassphrase();
        if (password == null) {
            return false;
        }

        String token = crypt.encrypt(plaintext, password);

        out.println("\n--- ENCRYPTION RESULT ---");
        out.println("Encrypted token (save this somewhere safe):");
        out.println(token);
        out.println();
        return true;
    }

    private boolean handleDecrypt() throws IOException {
        String token = prompt("\nEnter the encrypted token:\n> ");
        if (token == null) {
            return false;
        }
        if (token.isEmpty()) {
            out.println("No token provided.");
            return true;
        }

        String password = prompt("Enter the password or passphrase used for encryption:\n> ");
        if (password == null) {
            return false;
        }

        String plaintext;
        try {
            plaintext = crypt.decrypt(token, password);
        } catch (DecryptionException e) {
            out.println("\n!! Decryption failed.");
            out.println("Possible reasons:");
            out.println("  - Wrong password or passphrase");
            out.println("  - Corrupted or incomplete token");
            out.println("  - Token was not created by this program");
            out.println();
            return true;
        }

        out.println("\n--- DECRYPTION RESULT ---");
        out.println("Decrypted sentence:");
        out.println(plaintext);
        out.println();
        return true;
    }

    /** @return the chosen secret, or null at end of input */
    private String askForPasswordOrPassphrase() throws IOException {
        out.println("\nChoose password option:");
        out.println("  1) Type my own password");
        out.println("  2) Generate a random passphrase for me");
        String choice = prompt("Enter 1 or 2: ");
        if (choice == null) {
            return null;
        }

        if (choice.equals("2")) {
            String answer = prompt("How many words in the passphrase? (recommended: "
                    + config.defaultWords() + "-12): ");
            if (answer == null) {
                return null;
            }
            int words = parseWordCount(answer);
            String passphrase = crypt.generatePassphrase(wordList, words);
            StrengthReport report = crypt.estimateStrength(passphrase, true, GenerationParams.of(words, wordList));

            out.println("\n=== GENERATED PASSPHRASE ===");
            out.println(passphrase);
            printStrength(report);
            out.println("!! IMPORTANT: Save this passphrase. You need it to decrypt later. !!\n");
            return passphrase;
        }

        String password = prompt("Enter your password:\n> ");
        if (password == null) {
            return null;
        }
        out.println();
        printStrength(crypt.estimateStrength(password, false, null));
        return password;
    }

    private int parseWordCount(String answer) {
        int requested;
        try {
            requested = Integer.parseInt(answer);
        } catch (NumberFormatException e) {
            out.println("Invalid number, using " + config.defaultWords() + " words by default.");
            return config.defaultWords();
        }
        int words = config.clampWordCount(requested);
        if (requested < config.minWords()) {
            out.println("Too short, using " + words + " words for better security.");
        } else if (words < requested) {
            out.println("That's quite long. Limiting to " + words + " words.");
        }
        return words;
    }

    private void printStrength(StrengthReport report) {
        out.println(report.describe());
        out.println("Note: this is only an estimate, not a guarantee.\n");
    }

    private String prompt(String text) throws IOException {
        out.print(text);
        out.flush();
        String line = in.readLine();
        return line == null ? null : line.strip();
    }
}
