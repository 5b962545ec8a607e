package org.example.biolearn.service;

import org.example.biolearn.model.ChapterInput;
import org.example.biolearn.model.QuizInput;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed sample content inserted by {@link SeedService}: one chapter and three questions.
 */
final class SeedContent {

    static final String CHAPTER_SLUG = "cell-structure";

    static final ChapterInput CHAPTER = new ChapterInput(
            CHAPTER_SLUG,
            "Struktur dan Fungsi Sel",
            "Ikhtisar mandiri tentang struktur dasar sel prokariot dan eukariot, membran, organel, dan aliran energi.",
            List.of(
                    "Membedakan sel prokariot dan eukariot",
                    "Menjelaskan fungsi organel utama",
                    "Mengaitkan struktur membran dengan transport"
            ),
            List.of(
                    section("Gambaran Umum Sel", "Sel adalah unit dasar kehidupan."),
                    section("Organel Utama", "Nukleus, mitokondria, ribosom, retikulum endoplasma, dan lain-lain.")
            )
    );

    static final List<QuizInput> QUESTIONS = List.of(
            new QuizInput(
                    CHAPTER_SLUG,
                    "Komponen apakah yang paling berperan langsung dalam fosforilasi oksidatif pada sel eukariot?",
                    List.of("Ribosom", "Mitokondria membran dalam", "Aparatus Golgi", "Peroksisom"),
                    1,
                    "Rantai transpor elektron dan ATP sintase terletak pada membran dalam mitokondria.",
                    null
            ),
            new QuizInput(
                    CHAPTER_SLUG,
                    "Pada model mosaik fluida, fungsi utama kolesterol dalam membran adalah...",
                    List.of(
                            "Meningkatkan permeabilitas air",
                            "Menstabilkan fluiditas pada rentang suhu",
                            "Mengaktifkan pompa ion",
                            "Mengikat glikoprotein"
                    ),
                    1,
                    "Kolesterol membantu menjaga fluiditas membran tetap stabil terhadap perubahan suhu.",
                    null
            ),
            new QuizInput(
                    CHAPTER_SLUG,
                    "Manakah mekanisme transport yang memerlukan energi langsung dari ATP?",
                    List.of("Difusi sederhana", "Osmosis", "Difusi terfasilitasi", "Transpor aktif primer"),
                    3,
                    "Transpor aktif primer menggunakan energi ATP untuk memompa molekul melawan gradien.",
                    null
            )
    );

    private SeedContent() {
    }

    private static Map<String, String> section(String heading, String body) {
        Map<String, String> section = new LinkedHashMap<>();
        section.put("heading", heading);
        section.put("body", body);
        return Collections.unmodifiableMap(section);
    }
}
