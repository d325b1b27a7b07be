package com.product.resolution.variant;

import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.core.model.VariantInfo;
import com.product.resolution.core.model.VariantRecord;
import com.product.resolution.core.model.VariantType;
import com.product.resolution.rules.ProductNameRules;
import com.product.resolution.rules.ProductNormalizer;
import com.product.resolution.rules.Slugs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects pack-size, life-stage and breed-size tokens in product names.
 *
 * <p>Only size and pack differences are folded into a parent product. A different life stage or breed
 * size is a different product, even when the rest of the name is the same.</p>
 */
public class VariantClassifier {
    private static final Logger log = LoggerFactory.getLogger(VariantClassifier.class);

    /**
     * Classifies a single name in isolation. A name consolidates when it carries a size or pack token
     * and no life-stage or breed-size token.
     */
    public VariantInfo classify(String productName) {
        String name = productName != null ? productName : "";

        String sizeValue = firstMatch(ProductNameRules.SIZE_PATTERN, name);
        String packValue = firstMatch(ProductNameRules.PACK_PATTERN, name);
        Set<String> lifeStages = tokens(ProductNameRules.LIFE_STAGE_PATTERN, name);
        Set<String> breedSizes = breedSizeTokens(name);

        boolean hasSize = sizeValue != null;
        boolean hasPack = packValue != null;
        boolean hasLifeStage = !lifeStages.isEmpty();
        boolean hasBreedSize = !breedSizes.isEmpty();
        boolean consolidate = (hasSize || hasPack) && !(hasLifeStage || hasBreedSize);

        return new VariantInfo(hasSize, hasPack, hasLifeStage, hasBreedSize, consolidate,
                lifeStages, breedSizes, sizeValue, packValue);
    }

    /**
     * Classifies a candidate name against a known parent name. The candidate consolidates into the
     * parent when it carries a size or pack token, both names carry the same life-stage and breed-size
     * tokens, and both reduce to the same base name once size and pack tokens are removed.
     */
    public VariantInfo classifyAgainst(String candidateName, String parentName) {
        VariantInfo candidate = classify(candidateName);
        VariantInfo parent = classify(parentName);

        boolean consolidate = candidate.hasSizeOrPack()
                && candidate.lifeStageTokens().equals(parent.lifeStageTokens())
                && candidate.breedSizeTokens().equals(parent.breedSizeTokens())
                && baseSlug(candidateName).equals(baseSlug(parentName));

        log.debug("variant.compared candidate='{}' parent='{}' consolidate={}",
                candidateName, parentName, consolidate);
        return candidate.withShouldConsolidate(consolidate);
    }

    /**
     * Returns true when the two names are different but equal once size and pack tokens are removed.
     */
    public boolean differsOnlyByVariantTokens(String name1, String name2) {
        String base1 = baseSlug(name1);
        if (base1.isEmpty() || !base1.equals(baseSlug(name2))) {
            return false;
        }
        return !Slugs.slugify(name1).equals(Slugs.slugify(name2));
    }

    /**
     * Slug of the name with size and pack tokens removed.
     */
    public String baseSlug(String productName) {
        return Slugs.slugify(ProductNameRules.stripVariantTokens(productName));
    }

    /**
     * Builds the variant row recorded against a parent product. The variant key keeps the size and pack
     * tokens so each variant of a parent gets its own key.
     *
     * @throws IllegalArgumentException if the name carries neither a size nor a pack token
     */
    public VariantRecord toVariantRecord(String parentKey, NormalizedCandidate candidate, VariantInfo info) {
        Objects.requireNonNull(parentKey, "parentKey is required");
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(info, "info is required");

        String fullSlug = Slugs.truncate(Slugs.slugify(candidate.productName()), Slugs.MAX_NAME_SLUG_LENGTH);
        String variantKey = candidate.brandSlug() + ProductNormalizer.KEY_SEPARATOR + fullSlug;
        if (candidate.form().isKnown()) {
            variantKey = variantKey + ProductNormalizer.KEY_SEPARATOR + candidate.form().key();
        }

        return new VariantRecord(
                parentKey,
                variantKey,
                VariantType.of(info.hasSizeToken(), info.hasPackToken()),
                info.sizeValue(),
                info.packValue(),
                candidate.productName().trim(),
                candidate.productUrl(),
                Instant.now());
    }

    private static String firstMatch(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group().trim() : null;
    }

    private static Set<String> tokens(Pattern pattern, String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            found.add(m.group().toLowerCase(Locale.ROOT));
        }
        return found;
    }

    // "Medium Breed" and "medium" name the same size class; keep only the size word.
    private static Set<String> breedSizeTokens(String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = ProductNameRules.BREED_SIZE_PATTERN.matcher(text);
        while (m.find()) {
            found.add(m.group().trim().split("\\s+")[0].toLowerCase(Locale.ROOT));
        }
        return found;
    }
}
