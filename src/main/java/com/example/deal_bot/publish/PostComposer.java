package com.example.deal_bot.publish;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.example.deal_bot.deal.AffiliateLinkBuilder;
import com.example.deal_bot.deal.Candidate;

/**
 * 固定テンプレートで投稿本文を作る。テンプレートは UTC の時刻で切り替える。
 * 上限を超える場合はタイトルを切り詰める。
 */
@Component
public class PostComposer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PARENS = Pattern.compile("\\([^)]*\\)");
    private static final Pattern BRACKETS = Pattern.compile("\\[[^\\]]*\\]");
    private static final Pattern STORE_PREFIX = Pattern.compile("(?i)Amazon\\.com\\s*:?\\s*");
    private static final String ELLIPSIS = "...";
    private static final int MIN_TITLE_LENGTH = 20;

    // ===== テンプレート =====
    private static final List<String> GENERAL_TEMPLATES = List.of(
            "🔥 {discount}% OFF DEAL!\n\n{title}\n\nWas: {was}\nNow: {now}\nSave: {save}\n\n{url}\n\n#Deals #Sale #Discount",
            "⚡ FLASH DEAL ⚡\n\n{title}\n\n💰 {discount}% OFF ({save} savings)\n{was} ➡️ {now}\n\n{url}\n\n#Deals #Savings",
            "🔥 LIMITED TIME: {discount}% OFF!\n\n{title}\n\nPrice Drop: {was} ➡️ {now}\nYou Save: {save}\n\n{url}\n\n#DealAlert");

    private static final List<String> NICHE_TEMPLATES = List.of(
            "✨ BEAUTY STEAL ALERT ✨\n\n{title}\n\n🔥 {discount}% OFF\nWas: {was} ➡️ Now: {now}\nSave: {save}\n\n{url}\n\n#BeautyDeals #BeautyFinds",
            "💄 GLOW UP FOR LESS 💄\n\n{title}\n\n💰 {discount}% OFF ({save} savings!)\n{was} ➡️ {now}\n\n{url}\n\n#SkincareDeals #AffordableBeauty",
            "🌟 BEAUTY BARGAIN 🌟\n\n{title}\n\n🔥 Limited Time: {discount}% OFF\nPrice Drop: {was} ➡️ {now}\nYou Save: {save}\n\n{url}\n\n#BeautyBargain #MakeupFinds",
            "💅 STUNNING DEAL 💅\n\n{title}\n\n🔥 {discount}% OFF\nNormal: {was}\nSale: {now}\nSave: {save}\n\n{url}\n\n#BeautyDeals #GlowForLess");

    private final AffiliateLinkBuilder links;
    private final TwitterProperties props;
    private final Clock clock;

    public PostComposer(AffiliateLinkBuilder links, TwitterProperties props, Clock clock) {
        this.links = links;
        this.props = props;
        this.clock = clock;
    }

    public String compose(Candidate c, boolean niche) {
        List<String> templates = niche ? NICHE_TEMPLATES : GENERAL_TEMPLATES;
        int hour = clock.instant().atZone(ZoneOffset.UTC).getHour();
        String template = templates.get(hour % templates.size());

        String body = template
                .replace("{discount}", c.discountPercent().setScale(0, RoundingMode.DOWN).toPlainString())
                .replace("{was}", money(c.referencePrice()))
                .replace("{now}", money(c.currentPrice()))
                .replace("{save}", money(c.savings()))
                .replace("{url}", links.affiliateUrl(c.productId()));

        String title = cleanTitle(c.title(), props.getMaxTitleLength());
        String text = body.replace("{title}", title);
        int over = length(text) - props.getMaxLength();
        if (over > 0) {
            int keep = title.length() - over - ELLIPSIS.length();
            title = title.substring(0, Math.max(Math.min(MIN_TITLE_LENGTH, title.length()), keep)).trim() + ELLIPSIS;
            text = body.replace("{title}", title);
        }
        return text;
    }

    static String cleanTitle(String title, int maxLength) {
        if (title == null) {
            return "";
        }
        String t = WHITESPACE.matcher(title.trim()).replaceAll(" ");
        t = PARENS.matcher(t).replaceAll("");
        t = BRACKETS.matcher(t).replaceAll("");
        t = STORE_PREFIX.matcher(t).replaceAll("");
        t = WHITESPACE.matcher(t.trim()).replaceAll(" ");
        if (t.length() > maxLength) {
            t = t.substring(0, maxLength - ELLIPSIS.length()).trim() + ELLIPSIS;
        }
        return t;
    }

    private static String money(BigDecimal v) {
        return "$" + (v == null ? BigDecimal.ZERO : v).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static int length(String s) {
        return s.codePointCount(0, s.length());
    }
}
