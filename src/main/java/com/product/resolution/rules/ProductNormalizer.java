package com.product.resolution.rules;

import com.product.resolution.core.model.BrandIdentity;
import com.product.resolution.core.model.LifeStage;
import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.core.model.ProductForm;
import com.product.resolution.core.model.RawCandidateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns raw brand and product-name strings into a canonical brand and a deterministic product key.
 *
 * <p>Keys have the form {@code brand_slug|name_slug[|form]}. Name slugs have pack and size tokens removed
 * so size variants of the same product share a key. Every method is a pure function of its inputs and
 * the injected alias map, so one instance can be shared across threads.</p>
 */
public class ProductNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ProductNormalizer.class);

    public static final String KEY_SEPARATOR = "|";

    private final BrandAliasMap aliases;
    private final NormalizationEngine nameEngine;
    private final FormDetector formDetector;
    private final LifeStageDetector lifeStageDetector;

    public ProductNormalizer() {
        this(BrandAliasMap.empty());
    }

    public ProductNormalizer(BrandAliasMap aliases) {
        this(aliases, ProductNameRules.createDefaultEngine());
    }

    public ProductNormalizer(BrandAliasMap aliases, NormalizationEngine nameEngine) {
        this.aliases = Objects.requireNonNull(aliases, "aliases is required");
        this.nameEngine = Objects.requireNonNull(nameEngine, "nameEngine is required");
        this.formDetector = new FormDetector();
        this.lifeStageDetector = new LifeStageDetector();
    }

    /**
     * Resolves a raw brand to its canonical display name and slug.
     * Unusable input (null, blank, or nothing slug-worthy) yields {@link BrandIdentity#UNKNOWN}.
     */
    public BrandIdentity normalizeBrand(String rawBrand) {
        if (rawBrand == null || rawBrand.isBlank()) {
            return BrandIdentity.UNKNOWN;
        }
        String trimmed = rawBrand.trim();
        String canonical = aliases.lookup(trimmed).orElseGet(() -> Slugs.titleCase(trimmed));
        String slug = Slugs.slugify(canonical);
        if (slug.isEmpty()) {
            return BrandIdentity.UNKNOWN;
        }
        return new BrandIdentity(canonical, slug);
    }

    /**
     * Slugs a product name with pack and size tokens removed, truncated to
     * {@value Slugs#MAX_NAME_SLUG_LENGTH} characters. Returns the empty string when nothing is left.
     */
    public String normalizeProductName(String rawName) {
        String cleaned = nameEngine.normalize(rawName);
        return Slugs.truncate(Slugs.slugify(cleaned), Slugs.MAX_NAME_SLUG_LENGTH);
    }

    /**
     * Joins the slugs with {@code |}. A known form is appended as a third segment.
     */
    public String generateProductKey(String brandSlug, String nameSlug, ProductForm form) {
        Objects.requireNonNull(brandSlug, "brandSlug is required");
        Objects.requireNonNull(nameSlug, "nameSlug is required");
        StringBuilder key = new StringBuilder(brandSlug).append(KEY_SEPARATOR).append(nameSlug);
        if (form != null && form.isKnown()) {
            key.append(KEY_SEPARATOR).append(form.key());
        }
        return key.toString();
    }

    /**
     * Normalizes a full candidate record.
     *
     * @throws CandidateInputException if the brand or the product name is unusable
     */
    public NormalizedCandidate normalize(RawCandidateRecord raw) {
        Objects.requireNonNull(raw, "raw is required");
        BrandIdentity brand = normalizeBrand(raw.getBrand());
        if (brand.isUnknown()) {
            throw new CandidateInputException("brand",
                    "Candidate has no usable brand: '" + raw.getBrand() + "'");
        }
        if (raw.getProductName() == null || raw.getProductName().isBlank()) {
            throw new CandidateInputException("productName", "Candidate has no product name");
        }
        String nameSlug = normalizeProductName(raw.getProductName());
        if (nameSlug.isEmpty()) {
            throw new CandidateInputException("productName",
                    "Product name has nothing left after normalization: '" + raw.getProductName() + "'");
        }

        ProductForm form = formDetector.detect(raw.getFormHint(), raw.getProductName());
        LifeStage lifeStage = lifeStageDetector.detect(raw.getLifeStageHint(), raw.getProductName());
        String key = generateProductKey(brand.brandSlug(), nameSlug, form);

        log.debug("candidate.normalized brand={} key={} form={} lifeStage={}",
                brand.canonicalBrand(), key, form, lifeStage);
        return new NormalizedCandidate(raw, brand, nameSlug, form, lifeStage,
                UrlNormalizer.normalize(raw.getProductUrl()), key);
    }

    public BrandAliasMap getAliases() {
        return aliases;
    }
}
