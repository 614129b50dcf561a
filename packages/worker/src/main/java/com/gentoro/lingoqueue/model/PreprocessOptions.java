package com.gentoro.lingoqueue.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-job switches for the preprocessing pipeline. Fields missing from the job payload take the
 * defaults below, which are the single source of defaults for both the queue and HTTP entry
 * points.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PreprocessOptions(
    boolean expandAbbreviations,
    boolean filterProfanity,
    boolean normalizeRepeats,
    boolean removeEmoticons,
    boolean fixTypos,
    boolean addSpacing) {

  public static final PreprocessOptions DEFAULTS =
      new PreprocessOptions(true, false, true, true, true, true);

  @JsonCreator
  public static PreprocessOptions of(
      @JsonProperty("expandAbbreviations") @JsonAlias("expand_abbreviations")
          Boolean expandAbbreviations,
      @JsonProperty("filterProfanity") @JsonAlias("filter_profanity") Boolean filterProfanity,
      @JsonProperty("normalizeRepeats") @JsonAlias("normalize_repeats") Boolean normalizeRepeats,
      @JsonProperty("removeEmoticons") @JsonAlias("remove_emoticons") Boolean removeEmoticons,
      @JsonProperty("fixTypos") @JsonAlias("fix_typos") Boolean fixTypos,
      @JsonProperty("addSpacing") @JsonAlias("add_spacing") Boolean addSpacing) {
    return new PreprocessOptions(
        orDefault(expandAbbreviations, DEFAULTS.expandAbbreviations),
        orDefault(filterProfanity, DEFAULTS.filterProfanity),
        orDefault(normalizeRepeats, DEFAULTS.normalizeRepeats),
        orDefault(removeEmoticons, DEFAULTS.removeEmoticons),
        orDefault(fixTypos, DEFAULTS.fixTypos),
        orDefault(addSpacing, DEFAULTS.addSpacing));
  }

  private static boolean orDefault(Boolean value, boolean def) {
    return value == null ? def : value;
  }
}
