package com.example.deal_bot.publish;

/**
 * 外部SNSへの投稿口
 */
public interface Publisher {

    /**
     * @return 投稿ID
     * @throws PublishException 投稿に失敗した場合
     */
    String publish(String text);
}
