package com.gentoro.lingoqueue.preprocess;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Fixed dictionaries used by {@link TextPreprocessor}. Iteration order of every table is the
 * order entries are applied in.
 */
final class NormalizationTables {
  /** Matches when the literal is not glued to another letter, digit or underscore. */
  private static final String TOKEN_START = "(?<![\\p{L}\\p{N}_])";

  private static final String TOKEN_END = "(?![\\p{L}\\p{N}_])";

  static final Map<String, String> CONSONANT_ABBREVIATIONS;
  static final Map<String, String> SLANG;
  static final Map<String, String> TYPOS;
  static final List<Pattern> PROFANITY;

  static {
    Map<String, String> abbr = new LinkedHashMap<>();
    // greetings
    abbr.put("ㅎㅇ", "하이");
    abbr.put("ㅂㅂ", "바이바이");
    abbr.put("ㅂㅇ", "바이");
    abbr.put("ㅌㅌ", "도망가");
    // reactions
    abbr.put("ㅇㅈ", "인정");
    abbr.put("ㅁㅊ", "미쳤어");
    abbr.put("ㄷㄷ", "떨어");
    abbr.put("ㅜㅜ", "흑흑");
    abbr.put("ㅠㅠ", "흑흑");
    abbr.put("ㄲㅂ", "아깝다");
    abbr.put("ㅅㄱ", "수고");
    abbr.put("ㅇㅋ", "오케이");
    abbr.put("ㄱㅊ", "괜찮아");
    abbr.put("ㄱㅅ", "감사");
    abbr.put("ㄴㄴ", "노노");
    abbr.put("ㅈㅅ", "죄송");
    abbr.put("ㅁㄹ", "모르겠어");
    // laughter
    abbr.put("ㅋㅋ", "하하");
    abbr.put("ㅎㅎ", "하하");
    abbr.put("ㄲㅈ", "꺾여");
    // games and streaming
    abbr.put("ㅈㅈ", "굿 게임");
    abbr.put("ㄱㄱ", "고고");
    abbr.put("ㅅㅅ", "ㅅㅅ");
    abbr.put("ㅂㅌ", "배틀");
    abbr.put("ㄹㅇ", "진짜");
    abbr.put("ㅈㄴ", "진짜");
    abbr.put("ㅇㄱㄹㅇ", "이거 진짜");
    abbr.put("ㄹㅈㄷ", "레전드");
    abbr.put("ㅍㅇㅌ", "파이팅");
    CONSONANT_ABBREVIATIONS = Collections.unmodifiableMap(abbr);

    Map<String, String> slang = new LinkedHashMap<>();
    slang.put("ㄹㅈㄷ", "레전드");
    slang.put("ㅈㄱㄴ", "지금");
    slang.put("레게노", "레전드");
    slang.put("갓", "최고");
    slang.put("고트", "최고");
    slang.put("핵", "엄청");
    slang.put("졸라", "엄청");
    slang.put("개꿀", "엄청 좋은");
    slang.put("꿀잼", "재미있어");
    slang.put("노잼", "재미없어");
    slang.put("띵작", "명작");
    slang.put("명작", "최고작품");
    slang.put("갓작", "최고작품");
    slang.put("빡침", "화남");
    slang.put("개빡침", "엄청 화남");
    slang.put("별로", "그냥 그래");
    slang.put("개별로", "정말 안좋아");
    slang.put("좋아욥", "좋아요");
    slang.put("좋아염", "좋아요");
    slang.put("나쁘지않음", "나쁘지않아요");
    slang.put("웃김", "웃겨요");
    slang.put("웃기네", "웃겨요");
    slang.put("인정함", "인정해요");
    slang.put("쩔수지", "어쩔수없지");
    slang.put("쩔수", "어쩔수없지");
    slang.put("까비지", "아깝다");
    slang.put("까비", "아깝다");
    slang.put("쩔지", "대단하지");
    slang.put("ㅇㅇ", "응");
    slang.put("ㄴㄴ", "아니");
    slang.put("굿", "좋아");
    slang.put("베드", "나빠");
    slang.put("나이스", "좋아");
    slang.put("오케이", "괜찮아");
    slang.put("베리", "매우");
    slang.put("베리굿", "아주좋아");
    SLANG = Collections.unmodifiableMap(slang);

    Map<String, String> typos = new LinkedHashMap<>();
    typos.put("됬어요", "됐어요");
    typos.put("됬습니다", "됐습니다");
    typos.put("됬네요", "됐네요");
    typos.put("됬다", "됐다");
    typos.put("됬어", "됐어");
    typos.put("되요", "돼요");
    typos.put("되세요", "돼세요");
    typos.put("안되요", "안 돼요");
    typos.put("안돼요", "안 돼요");
    typos.put("할려고", "하려고");
    typos.put("할려면", "하려면");
    typos.put("할려", "하려");
    typos.put("왠만", "웬만");
    typos.put("왠일", "웬일");
    TYPOS = Collections.unmodifiableMap(typos);

    PROFANITY =
        List.of(
            wholeToken("ㅅㅂ"),
            wholeToken("ㅂㅅ"),
            Pattern.compile("시발"),
            Pattern.compile("씨발"),
            Pattern.compile("병신"),
            Pattern.compile("ㅈ같"),
            Pattern.compile("ㅆ발"),
            Pattern.compile("ㅂ신"));
  }

  private NormalizationTables() {}

  static Pattern wholeToken(String literal) {
    return Pattern.compile(TOKEN_START + Pattern.quote(literal) + TOKEN_END);
  }

  /** Compiles each key of {@code table} as a whole-token pattern, keeping table order. */
  static Map<Pattern, String> wholeTokenRules(Map<String, String> table) {
    Map<Pattern, String> rules = new LinkedHashMap<>();
    table.forEach((from, to) -> rules.put(wholeToken(from), to));
    return Collections.unmodifiableMap(rules);
  }
}
