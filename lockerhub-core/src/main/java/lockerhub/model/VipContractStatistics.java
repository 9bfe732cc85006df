package lockerhub.model;

public record VipContractStatistics(int total, int active, int expired, int cancelled, int expiringSoon) {}
