package com.webclipper.core.extract;

/**
 * 단어 수 휴리스틱: 한글 음절은 1자당 1, 라틴 문자 연속 구간은 구간당 1.
 * 숫자/기호는 세지 않는다.
 */
public final class WordCounter {
    private WordCounter() {}

    public static int count(String text) {
        if (text == null || text.isEmpty()) return 0;
        int words = 0;
        boolean inLatin = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '가' && c <= '힣') {   // 가-힣
                words++;
                inLatin = false;
            } else if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
                if (!inLatin) words++;
                inLatin = true;
            } else {
                inLatin = false;
            }
        }
        return words;
    }
}
